package com.ryuqq.router.application.dispatcher;

import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.contract.Request;
import com.ryuqq.router.core.contract.Response;
import com.ryuqq.router.core.exception.UnrecognizedProcedureException;

/**
 * 요청 디스패처 (호스트 진입점).
 *
 * <p>호스트는 wire format을 Request로 디코딩한 뒤 이 메서드 하나만 호출하고,
 * 반환된 Response를 다시 인코딩하여 호출자에게 돌려줍니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     Response response = dispatcher.handle(context, Request.of("Do", body));
 *     if (response.isSuccess()) {
 *         // response.bodyOrNull()
 *     } else {
 *         // response.errorOrNull() - Handler 실패, 호출 자체는 성공
 *     }
 * } catch (UnrecognizedProcedureException e) {
 *     // 등록되지 않은 procedure - 호출 실패로 전파
 * }
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * Request 처리.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>procedure 이름으로 Handler 조회</li>
     *   <li>없으면 UnrecognizedProcedureException (유일한 호출 실패)</li>
     *   <li>Handler 호출 (context는 변경 없이 전달)</li>
     *   <li>성공 시 → Response.success(result)</li>
     *   <li>Handler 예외 시 → ErrorEncoder로 인코딩 → Response.failure(encoded)</li>
     *   <li>인코딩 실패 시 → 원래 오류 메시지 평문 → Response.failure(message)</li>
     * </ol>
     *
     * <p>여러 스레드에서 동시에 호출될 수 있습니다.</p>
     *
     * @param context 호출 컨텍스트
     * @param request 요청 봉투
     * @return Response (null 불가, body/error 중 정확히 하나 존재)
     * @throws UnrecognizedProcedureException procedure에 바인딩된 Handler가 없는 경우
     * @throws IllegalArgumentException context 또는 request가 null인 경우
     */
    Response handle(InvocationContext context, Request request) throws UnrecognizedProcedureException;
}

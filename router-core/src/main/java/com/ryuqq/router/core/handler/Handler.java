package com.ryuqq.router.core.handler;

import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.model.Payload;

/**
 * procedure 하나를 처리하는 Handler.
 *
 * <p>Router는 Request의 procedure 이름으로 등록된 Handler를 찾아 호출합니다.
 * 하나의 procedure 이름에는 한 시점에 하나의 Handler만 바인딩됩니다.</p>
 *
 * <p><strong>두 가지 구현 방식:</strong></p>
 * <ul>
 *   <li>이 인터페이스를 직접 구현하는 클래스</li>
 *   <li>{@link #of(HandlerFunction)}로 함수 값을 감싼 {@link FunctionHandler}</li>
 * </ul>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>예외를 던지면 Router가 이를 오류 Payload로 인코딩하여 Response에 담습니다.</li>
 *   <li>예외는 Router 호출자에게 전파되지 않습니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public final class CreateOrderHandler implements Handler {
 *     {@literal @}Override
 *     public Payload handle(InvocationContext context, Payload body) throws Exception {
 *         context.throwIfCancelled();
 *         return Payload.of(orderService.create(body.getValue()));
 *     }
 * }
 *
 * router.route("CreateOrder", new CreateOrderHandler());
 * router.route("Ping", Handler.of((context, body) -&gt; Payload.of("\"pong\"")));
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public interface Handler {

    /**
     * 요청 본문 처리.
     *
     * @param context 호출 컨텍스트 (취소/마감 시각을 존중할 책임은 구현체에 있음)
     * @param body 요청 본문 (null 불가, 비어있을 수 있음)
     * @return 응답 본문 (null이면 Router가 빈 Payload로 정규화)
     * @throws Exception 처리 실패 시, Router가 오류 Payload로 인코딩
     */
    Payload handle(InvocationContext context, Payload body) throws Exception;

    /**
     * 함수 값을 Handler로 변환.
     *
     * @param function Handler 함수
     * @return function을 호출하는 Handler
     * @throws IllegalArgumentException function이 null인 경우
     */
    static Handler of(HandlerFunction function) {
        return new FunctionHandler(function);
    }
}

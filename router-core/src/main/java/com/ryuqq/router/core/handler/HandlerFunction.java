package com.ryuqq.router.core.handler;

import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.model.Payload;

/**
 * Handler로 사용할 수 있는 함수 시그니처.
 *
 * <p>람다나 메서드 참조를 {@link Handler#of(HandlerFunction)}로 감싸 등록합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandlerFunction {

    /**
     * 요청 본문 처리.
     *
     * @param context 호출 컨텍스트
     * @param body 요청 본문
     * @return 응답 본문
     * @throws Exception 처리 실패 시
     */
    Payload apply(InvocationContext context, Payload body) throws Exception;
}

package com.ryuqq.router.core.handler;

import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.model.Payload;

/**
 * 함수 값을 감싸는 Handler 어댑터.
 *
 * <p>handle(context, body)는 function.apply(context, body)를 그대로 호출합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class FunctionHandler implements Handler {

    private final HandlerFunction function;

    /**
     * 생성자.
     *
     * @param function 감쌀 함수
     * @throws IllegalArgumentException function이 null인 경우
     */
    public FunctionHandler(HandlerFunction function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        this.function = function;
    }

    @Override
    public Payload handle(InvocationContext context, Payload body) throws Exception {
        return function.apply(context, body);
    }

    @Override
    public String toString() {
        return "FunctionHandler{" + function + '}';
    }
}

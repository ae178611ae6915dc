package com.ryuqq.router.core.spi.noop;

import com.ryuqq.router.core.spi.DispatchObserver;

/**
 * Dispatch Observer NoOp 구현.
 *
 * <p>모든 이벤트를 무시합니다. Router의 기본 Observer입니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class NoOpDispatchObserver implements DispatchObserver {

    @Override
    public void onUnrecognizedProcedure(String procedure) {
        // NoOp
    }

    @Override
    public void onHandlerError(String procedure, Exception error) {
        // NoOp
    }

    @Override
    public void onErrorEncodingFailure(String procedure, Exception error, Exception encodingFailure) {
        // NoOp
    }
}

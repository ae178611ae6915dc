package com.ryuqq.router.core.spi;

/**
 * Dispatch Observability SPI.
 *
 * <p>Router receives diagnostic events that never reach the caller through this hook. The
 * most important one is a failing {@link com.ryuqq.router.core.encoding.ErrorEncoder}: the
 * Router swallows that failure and falls back to the original error message, so the observer
 * is the only place it can be recorded.</p>
 *
 * <p><strong>Callbacks:</strong></p>
 * <ul>
 *   <li>onUnrecognizedProcedure(): a request named a procedure with no handler</li>
 *   <li>onHandlerError(): a handler threw; the error is being encoded into the response</li>
 *   <li>onErrorEncodingFailure(): the configured encoder threw or returned null</li>
 * </ul>
 *
 * <p><strong>Implementation Guidelines:</strong></p>
 * <ul>
 *   <li>Callbacks run on the dispatching thread and must be fast</li>
 *   <li>Implementations must be thread-safe</li>
 *   <li>A {@link RuntimeException} thrown by a callback is logged by the Router and
 *       does not change the response</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 * @see com.ryuqq.router.core.spi.noop.NoOpDispatchObserver
 */
public interface DispatchObserver {

    /**
     * Called when no handler is bound to the requested procedure.
     *
     * @param procedure the procedure name, verbatim
     */
    void onUnrecognizedProcedure(String procedure);

    /**
     * Called when a handler throws.
     *
     * @param procedure the procedure name
     * @param error the handler's exception
     */
    void onHandlerError(String procedure, Exception error);

    /**
     * Called when the error encoder fails for a handler error.
     *
     * @param procedure the procedure name
     * @param error the handler's original exception
     * @param encodingFailure the encoder's exception, or an {@link IllegalStateException}
     *                        when the encoder returned null
     */
    void onErrorEncodingFailure(String procedure, Exception error, Exception encodingFailure);
}

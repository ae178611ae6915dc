package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.spi.DispatchObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DispatchObserver that emits logs via SLF4J.
 *
 * <p><strong>Log Levels:</strong></p>
 * <ul>
 *   <li>WARN: unrecognized procedure, error encoder failure</li>
 *   <li>DEBUG: handler error (already returned to the caller inside the response)</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class Slf4jDispatchObserver implements DispatchObserver {

    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObserver.class);

    @Override
    public void onUnrecognizedProcedure(String procedure) {
        log.warn("Unrecognized procedure '{}'", procedure);
    }

    @Override
    public void onHandlerError(String procedure, Exception error) {
        log.debug("Handler for '{}' failed: {}", procedure, error.toString());
    }

    @Override
    public void onErrorEncodingFailure(String procedure, Exception error, Exception encodingFailure) {
        log.warn("Error encoder failed for '{}', falling back to message of {}",
            procedure, error.getClass().getName(), encodingFailure);
    }
}

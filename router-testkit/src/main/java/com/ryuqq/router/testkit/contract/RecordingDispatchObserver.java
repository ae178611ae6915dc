package com.ryuqq.router.testkit.contract;

import com.ryuqq.router.core.spi.DispatchObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * DispatchObserver that keeps every event in memory for assertions.
 *
 * @author Router Team
 * @since 1.0.0
 */
public class RecordingDispatchObserver implements DispatchObserver {

    private final List<String> unrecognized = new CopyOnWriteArrayList<>();
    private final List<Exception> handlerErrors = new CopyOnWriteArrayList<>();
    private final List<Exception> encodingFailures = new CopyOnWriteArrayList<>();

    @Override
    public void onUnrecognizedProcedure(String procedure) {
        unrecognized.add(procedure);
    }

    @Override
    public void onHandlerError(String procedure, Exception error) {
        handlerErrors.add(error);
    }

    @Override
    public void onErrorEncodingFailure(String procedure, Exception error, Exception encodingFailure) {
        encodingFailures.add(encodingFailure);
    }

    public List<String> unrecognizedProcedures() {
        return List.copyOf(unrecognized);
    }

    public List<Exception> handlerErrors() {
        return List.copyOf(handlerErrors);
    }

    public List<Exception> encodingFailures() {
        return List.copyOf(encodingFailures);
    }

    /**
     * Clears all recorded events.
     */
    public void clear() {
        unrecognized.clear();
        handlerErrors.clear();
        encodingFailures.clear();
    }
}

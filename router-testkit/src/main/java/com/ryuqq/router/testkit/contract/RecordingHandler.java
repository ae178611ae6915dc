package com.ryuqq.router.testkit.contract;

import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.handler.Handler;
import com.ryuqq.router.core.model.Payload;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler test double that records every invocation.
 *
 * <p>Returns a fixed payload, echoes its input, or throws a fixed exception. Thread-safe.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class RecordingHandler implements Handler {

    private final boolean echo;
    private final Payload result;
    private final Exception failure;
    private final List<InvocationContext> contexts = new CopyOnWriteArrayList<>();
    private final List<Payload> bodies = new CopyOnWriteArrayList<>();

    private RecordingHandler(boolean echo, Payload result, Exception failure) {
        this.echo = echo;
        this.result = result;
        this.failure = failure;
    }

    /**
     * Creates a handler that returns the given payload.
     *
     * @param result the payload to return (may be null to exercise normalization)
     * @return a new recording handler
     */
    public static RecordingHandler returning(Payload result) {
        return new RecordingHandler(false, result, null);
    }

    /**
     * Creates a handler that returns its input body.
     *
     * @return a new recording handler
     */
    public static RecordingHandler echo() {
        return new RecordingHandler(true, null, null);
    }

    /**
     * Creates a handler that throws the given exception.
     *
     * @param failure the exception to throw
     * @return a new recording handler
     */
    public static RecordingHandler failingWith(Exception failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new RecordingHandler(false, null, failure);
    }

    @Override
    public Payload handle(InvocationContext context, Payload body) throws Exception {
        contexts.add(context);
        bodies.add(body);
        if (failure != null) {
            throw failure;
        }
        return echo ? body : result;
    }

    public int invocationCount() {
        return bodies.size();
    }

    public InvocationContext lastContext() {
        return contexts.isEmpty() ? null : contexts.get(contexts.size() - 1);
    }

    public Payload lastBody() {
        return bodies.isEmpty() ? null : bodies.get(bodies.size() - 1);
    }
}

package com.ryuqq.router.core.context;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 취소 가능한 호출 컨텍스트.
 *
 * <p>호스트가 호출마다 생성하여 Router에 전달하며, Router는 이를 변경 없이 Handler에 넘깁니다.
 * 취소와 마감 시각을 존중할 책임은 Handler에 있습니다. Router는 자체 타임아웃 정책을 두지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * InvocationContext context = InvocationContext.withDeadline("req-123", Instant.now().plusSeconds(3));
 * Response response = dispatcher.handle(context, request);
 *
 * // Handler 내부
 * context.throwIfCancelled();
 * </pre>
 *
 * <p><strong>동시성:</strong> cancel()은 다른 스레드에서 호출될 수 있으며, 취소 상태는 즉시 관찰됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class InvocationContext {

    private final String requestId;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private InvocationContext(String requestId, Instant deadline) {
        this.requestId = requestId;
        this.deadline = deadline;
    }

    /**
     * 요청 ID와 마감 시각이 없는 컨텍스트 생성.
     *
     * @return 새 InvocationContext
     */
    public static InvocationContext background() {
        return new InvocationContext(null, null);
    }

    /**
     * 요청 ID만 지정한 컨텍스트 생성.
     *
     * @param requestId 호스트가 부여한 요청 ID (null 허용)
     * @return 새 InvocationContext
     */
    public static InvocationContext of(String requestId) {
        return new InvocationContext(requestId, null);
    }

    /**
     * 마감 시각을 지정한 컨텍스트 생성.
     *
     * @param requestId 호스트가 부여한 요청 ID (null 허용)
     * @param deadline 마감 시각
     * @return 새 InvocationContext
     * @throws IllegalArgumentException deadline이 null인 경우
     */
    public static InvocationContext withDeadline(String requestId, Instant deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        return new InvocationContext(requestId, deadline);
    }

    /**
     * 요청 ID 조회.
     *
     * @return 요청 ID (없으면 empty)
     */
    public Optional<String> requestId() {
        return Optional.ofNullable(requestId);
    }

    /**
     * 마감 시각 조회.
     *
     * @return 마감 시각 (없으면 empty)
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * 컨텍스트 취소.
     *
     * <p>여러 번 호출해도 안전합니다.</p>
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * 취소 여부 확인.
     *
     * @return cancel()이 호출되었으면 true
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 마감 시각 경과 여부 확인.
     *
     * @param clock 현재 시각 기준
     * @return 마감 시각이 있고 이미 지났으면 true
     */
    public boolean isExpired(Clock clock) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * 취소되었거나 마감 시각이 지난 경우 예외 발생.
     *
     * @throws CancellationException 취소 또는 마감 시각 경과 시
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("invocation cancelled" + describeRequest());
        }
        if (isExpired(Clock.systemUTC())) {
            throw new CancellationException("invocation deadline exceeded" + describeRequest());
        }
    }

    private String describeRequest() {
        return requestId == null ? "" : " (requestId: " + requestId + ")";
    }

    @Override
    public String toString() {
        return "InvocationContext{requestId=" + requestId
            + ", deadline=" + deadline
            + ", cancelled=" + cancelled.get() + '}';
    }
}

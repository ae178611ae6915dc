package com.ryuqq.router.core.spi;

import com.ryuqq.router.core.handler.Handler;

import java.util.Optional;
import java.util.Set;

/**
 * Handler 등록 테이블 SPI (Service Provider Interface).
 *
 * <p>procedure 이름 → {@link Handler} 바인딩을 관리합니다.
 * Router 인스턴스마다 하나씩 소유하며, 프로세스 전역 상태가 아닙니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>이름당 최대 하나의 Handler 바인딩 유지</li>
 *   <li>같은 이름으로 재등록 시 이전 바인딩 교체 (마지막 등록 우선, 오류/경고 없음)</li>
 *   <li>이름 정규화 없음 (대소문자 구분, trim 없음, 빈 문자열도 유효한 키)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>등록은 트래픽 시작 전에 완료되는 것을 전제로 합니다.</li>
 *   <li>lookup()은 여러 스레드에서 동시에 호출될 수 있습니다.</li>
 *   <li>실행 중 재등록이 필요한 호스트는 thread-safe 구현체를 사용해야 합니다.</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public class MapHandlerRegistry implements HandlerRegistry {
 *     private final Map&lt;String, Handler&gt; handlers = new HashMap&lt;&gt;();
 *
 *     {@literal @}Override
 *     public void register(String procedure, Handler handler) {
 *         handlers.put(procedure, handler);
 *     }
 *
 *     {@literal @}Override
 *     public Optional&lt;Handler&gt; lookup(String procedure) {
 *         return Optional.ofNullable(handlers.get(procedure));
 *     }
 *
 *     {@literal @}Override
 *     public Set&lt;String&gt; procedures() {
 *         return Set.copyOf(handlers.keySet());
 *     }
 * }
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public interface HandlerRegistry {

    /**
     * Handler 등록.
     *
     * <p>같은 이름에 이미 Handler가 있으면 교체합니다.</p>
     *
     * @param procedure procedure 이름 (빈 문자열 허용)
     * @param handler 바인딩할 Handler
     * @throws IllegalArgumentException procedure 또는 handler가 null인 경우
     */
    void register(String procedure, Handler handler);

    /**
     * Handler 조회 (읽기 전용).
     *
     * @param procedure procedure 이름
     * @return 바인딩된 Handler (없으면 empty)
     * @throws IllegalArgumentException procedure가 null인 경우
     */
    Optional<Handler> lookup(String procedure);

    /**
     * 등록된 procedure 이름 목록.
     *
     * @return 호출 시점의 불변 스냅샷
     */
    Set<String> procedures();
}

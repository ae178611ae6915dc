package com.ryuqq.router.application.config;

import com.ryuqq.router.core.encoding.ErrorEncoder;
import com.ryuqq.router.core.encoding.ErrorEncoders;
import com.ryuqq.router.core.spi.DispatchObserver;
import com.ryuqq.router.core.spi.noop.NoOpDispatchObserver;

/**
 * Router 설정 (불변 record).
 *
 * <p>Router 생성 시 {@link RouterOption}들이 순서대로 적용되어 최종 설정이 결정되며,
 * 이후에는 변경되지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>errorEncoder: Handler 오류 → 오류 Payload 변환 전략 (기본: 메시지 평문)</li>
 *   <li>observer: 진단 이벤트 수신자 (기본: NoOp)</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 * @param errorEncoder 오류 인코딩 전략 (null 불가)
 * @param observer 진단 이벤트 수신자 (null 불가)
 */
public record RouterConfig(
    ErrorEncoder errorEncoder,
    DispatchObserver observer
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RouterConfig {
        if (errorEncoder == null) {
            throw new IllegalArgumentException("errorEncoder cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
    }

    /**
     * 기본 설정 생성.
     *
     * <p>기본값: errorEncoder=ErrorEncoders.messageOnly(), observer=NoOpDispatchObserver</p>
     *
     * @return 기본 RouterConfig
     */
    public static RouterConfig defaults() {
        return new RouterConfig(ErrorEncoders.messageOnly(), new NoOpDispatchObserver());
    }

    /**
     * 옵션들을 순서대로 적용한 설정 생성.
     *
     * @param options 적용할 옵션 (null 또는 빈 배열이면 기본 설정)
     * @return 최종 RouterConfig
     * @throws IllegalArgumentException 옵션 중 null이 있거나 옵션이 null을 반환한 경우
     */
    public static RouterConfig from(RouterOption... options) {
        RouterConfig config = defaults();
        if (options == null) {
            return config;
        }
        for (RouterOption option : options) {
            if (option == null) {
                throw new IllegalArgumentException("option cannot be null");
            }
            config = option.apply(config);
            if (config == null) {
                throw new IllegalArgumentException("option must not return null config");
            }
        }
        return config;
    }

    /**
     * errorEncoder만 변경한 새 인스턴스 생성.
     */
    public RouterConfig withErrorEncoder(ErrorEncoder errorEncoder) {
        return new RouterConfig(errorEncoder, observer);
    }

    /**
     * observer만 변경한 새 인스턴스 생성.
     */
    public RouterConfig withObserver(DispatchObserver observer) {
        return new RouterConfig(errorEncoder, observer);
    }
}

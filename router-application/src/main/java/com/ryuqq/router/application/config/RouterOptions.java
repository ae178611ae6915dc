package com.ryuqq.router.application.config;

import com.ryuqq.router.core.encoding.ErrorEncoder;
import com.ryuqq.router.core.spi.DispatchObserver;

/**
 * 기본 제공 Router 옵션.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Router router = new Router(
 *     RouterOptions.marshalErrorsWith(new JsonErrorEncoder(objectMapper)),
 *     RouterOptions.observeWith(new Slf4jDispatchObserver())
 * );
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class RouterOptions {

    private RouterOptions() {
    }

    /**
     * Handler 오류 인코딩 전략 교체.
     *
     * <p>오류 값에 담긴 추가 정보를 응답에 싣고 싶을 때 사용합니다.
     * 인코더가 실패하면(예외 또는 null 반환) Router는 원래 오류 메시지를 평문으로 사용합니다.</p>
     *
     * @param errorEncoder 오류 인코더
     * @return RouterOption
     * @throws IllegalArgumentException errorEncoder가 null인 경우
     */
    public static RouterOption marshalErrorsWith(ErrorEncoder errorEncoder) {
        if (errorEncoder == null) {
            throw new IllegalArgumentException("errorEncoder cannot be null");
        }
        return config -> config.withErrorEncoder(errorEncoder);
    }

    /**
     * 진단 이벤트 수신자 설정.
     *
     * @param observer DispatchObserver
     * @return RouterOption
     * @throws IllegalArgumentException observer가 null인 경우
     */
    public static RouterOption observeWith(DispatchObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        return config -> config.withObserver(observer);
    }
}

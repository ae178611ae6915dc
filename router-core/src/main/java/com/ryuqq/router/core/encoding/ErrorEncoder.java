package com.ryuqq.router.core.encoding;

import com.ryuqq.router.core.model.Payload;

/**
 * Handler 오류를 응답 Payload로 변환하는 전략.
 *
 * <p>Router 생성 시 한 번 설정되며 이후 변경되지 않습니다.
 * 인코딩이 실패하면(예외 또는 null 반환) Router는 원래 오류의 메시지를 평문 Payload로 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ErrorEncoder encoder = error -&gt; Payload.of("{\"message\":\"" + error.getMessage() + "\"}");
 * Router router = new Router(RouterOptions.marshalErrorsWith(encoder));
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 * @see ErrorEncoders#messageOnly()
 */
@FunctionalInterface
public interface ErrorEncoder {

    /**
     * 오류 인코딩.
     *
     * @param error Handler가 던진 예외 (null 불가)
     * @return 오류 Payload
     * @throws Exception 인코딩 실패 시 (Router가 흡수하고 원래 메시지로 대체)
     */
    Payload encode(Exception error) throws Exception;
}

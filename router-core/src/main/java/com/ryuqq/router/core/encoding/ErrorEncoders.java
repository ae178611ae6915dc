package com.ryuqq.router.core.encoding;

import com.ryuqq.router.core.model.Payload;

/**
 * 기본 ErrorEncoder 모음.
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class ErrorEncoders {

    private static final ErrorEncoder MESSAGE_ONLY = error -> Payload.of(describe(error));

    private ErrorEncoders() {
    }

    /**
     * 오류 메시지만 평문으로 담는 기본 인코더.
     *
     * <p>이 인코더는 실패하지 않습니다.</p>
     *
     * @return 메시지 전용 ErrorEncoder
     */
    public static ErrorEncoder messageOnly() {
        return MESSAGE_ONLY;
    }

    /**
     * 오류의 사람이 읽을 수 있는 메시지 조회.
     *
     * <p>getMessage()가 null이면 예외 클래스 이름을 사용합니다.</p>
     *
     * @param error 예외
     * @return 메시지 (null 불가)
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static String describe(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }
}

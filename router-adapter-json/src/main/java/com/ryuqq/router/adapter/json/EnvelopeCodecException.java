package com.ryuqq.router.adapter.json;

/**
 * JSON envelope를 읽거나 쓸 수 없을 때 발생하는 예외.
 *
 * <p>Jackson 파싱 오류는 cause로 보존됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class EnvelopeCodecException extends RuntimeException {

    public EnvelopeCodecException(String message) {
        super(message);
    }

    public EnvelopeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

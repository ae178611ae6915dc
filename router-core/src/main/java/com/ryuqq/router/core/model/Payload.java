package com.ryuqq.router.core.model;

import java.nio.charset.StandardCharsets;

/**
 * 해석되지 않은 상태로 전달되는 데이터 블록.
 *
 * <p>Payload는 요청 본문과 응답 본문(성공/오류)을 모두 표현합니다.
 * Router는 내용을 해석하지 않으며, 직렬화 형식(JSON, XML 등)은 호스트가 결정합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>JSON: Payload.of("{\"key\":\"value\"}")</li>
 *   <li>평문 오류 메시지: Payload.of("insufficient balance")</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null은 빈 Payload로 정규화</li>
 *   <li>길이 제한 없음</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload("");

    private final String value;

    private Payload(String value) {
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value Payload 값 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        return new Payload(value);
    }

    /**
     * UTF-8 바이트로부터 Payload 생성.
     *
     * @param bytes UTF-8 인코딩된 바이트 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload ofUtf8(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new Payload(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * 빈 Payload 조회.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * Payload 값 조회.
     *
     * @return Payload 값 (null 불가, 빈 문자열 가능)
     */
    public String getValue() {
        return value;
    }

    /**
     * UTF-8 바이트 배열로 변환.
     *
     * @return 새로 할당된 바이트 배열
     */
    public byte[] toUtf8Bytes() {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value.length() + " chars}";
    }
}

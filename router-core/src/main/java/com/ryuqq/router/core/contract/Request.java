package com.ryuqq.router.core.contract;

import com.ryuqq.router.core.model.Payload;

/**
 * 라우팅 가능한 요청 봉투 (Request Envelope).
 *
 * <p>호스트가 wire format을 디코딩하여 생성하며, 어떤 Handler가 요청을 처리할지
 * 지정하는 procedure 이름과 Handler에 전달될 본문을 담고 있습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>procedure:</strong> Handler 등록 키 (정확히 일치해야 함, 대소문자 구분, trim 없음)</li>
 *   <li><strong>body:</strong> Handler에 전달될 Payload (없으면 빈 Payload)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Request request = Request.of("Do", Payload.of("{\"key\":\"value\"}"));
 *
 * // 본문 없는 요청
 * Request request = Request.of("Ping");
 * </pre>
 *
 * @param procedure 처리할 procedure 이름 (빈 문자열 허용)
 * @param body 요청 본문
 *
 * @author Router Team
 * @since 1.0.0
 */
public record Request(
    String procedure,
    Payload body
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException procedure가 null인 경우
     */
    public Request {
        if (procedure == null) {
            throw new IllegalArgumentException("procedure cannot be null");
        }
        if (body == null) {
            body = Payload.empty();
        }
    }

    /**
     * Request 생성.
     *
     * @param procedure procedure 이름
     * @param body 요청 본문 (null이면 빈 Payload)
     * @return Request 인스턴스
     * @throws IllegalArgumentException procedure가 null인 경우
     */
    public static Request of(String procedure, Payload body) {
        return new Request(procedure, body);
    }

    /**
     * 본문 없는 Request 생성.
     *
     * @param procedure procedure 이름
     * @return Request 인스턴스
     * @throws IllegalArgumentException procedure가 null인 경우
     */
    public static Request of(String procedure) {
        return new Request(procedure, Payload.empty());
    }
}

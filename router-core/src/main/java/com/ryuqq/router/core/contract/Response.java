package com.ryuqq.router.core.contract;

import com.ryuqq.router.core.model.Payload;

/**
 * 정규화된 응답 봉투 (Response Envelope).
 *
 * <p>인식된 procedure에 대한 모든 호출 결과는 Response로 표현됩니다.
 * Handler가 실패한 경우에도 예외가 아니라 error 필드에 인코딩된 오류가 담깁니다.</p>
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>성공:</strong> body = Handler 결과, error = null</li>
 *   <li><strong>Handler 실패:</strong> body = null, error = 인코딩된 오류</li>
 * </ul>
 *
 * <p>둘 다 null이거나 둘 다 존재하는 Response는 생성할 수 없습니다.</p>
 *
 * @param body 성공 Payload (실패 시 null)
 * @param error 오류 Payload (성공 시 null)
 *
 * @author Router Team
 * @since 1.0.0
 */
public record Response(
    Payload body,
    Payload error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException body와 error 중 정확히 하나만 존재하지 않는 경우
     */
    public Response {
        if (body == null && error == null) {
            throw new IllegalArgumentException("either body or error must be present");
        }
        if (body != null && error != null) {
            throw new IllegalArgumentException("body and error cannot both be present");
        }
    }

    /**
     * 성공 Response 생성.
     *
     * @param body Handler 결과
     * @return Response 인스턴스
     * @throws IllegalArgumentException body가 null인 경우
     */
    public static Response success(Payload body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return new Response(body, null);
    }

    /**
     * 실패 Response 생성.
     *
     * @param error 인코딩된 오류
     * @return Response 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Response failure(Payload error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Response(null, error);
    }

    /**
     * 성공 여부 확인.
     *
     * @return body가 존재하면 true
     */
    public boolean isSuccess() {
        return body != null;
    }

    /**
     * 실패 여부 확인.
     *
     * @return error가 존재하면 true
     */
    public boolean isFailure() {
        return error != null;
    }

    /**
     * 성공 Payload 조회.
     *
     * @return body (실패 시 null)
     */
    public Payload bodyOrNull() {
        return body;
    }

    /**
     * 오류 Payload 조회.
     *
     * @return error (성공 시 null)
     */
    public Payload errorOrNull() {
        return error;
    }
}

package com.ryuqq.router.core.exception;

/**
 * 라우팅 메커니즘 자체의 실패.
 *
 * <p>Handler의 업무 오류와 구분됩니다. Handler 오류는 Response에 인코딩되고,
 * DispatchException만 Router 호출자에게 전파됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class DispatchException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public DispatchException(String message) {
        super(message);
    }
}

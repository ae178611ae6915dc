package com.ryuqq.router.core.exception;

/**
 * 등록되지 않은 procedure로 요청이 들어온 경우.
 *
 * <p>메시지 형식은 고정입니다: {@code unrecognized procedure '<name>'}</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class UnrecognizedProcedureException extends DispatchException {

    private static final long serialVersionUID = 1L;

    private final String procedure;

    /**
     * 생성자.
     *
     * @param procedure 인식되지 않은 procedure 이름 (그대로 메시지에 포함)
     */
    public UnrecognizedProcedureException(String procedure) {
        super("unrecognized procedure '" + procedure + "'");
        this.procedure = procedure;
    }

    /**
     * 인식되지 않은 procedure 이름 조회.
     *
     * @return procedure 이름
     */
    public String procedure() {
        return procedure;
    }
}

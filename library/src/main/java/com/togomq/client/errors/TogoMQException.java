package com.togomq.client.errors;

/**
 * Failure reported by the TogoMQ client. Carries a category, a description of
 * what the client was doing and, when there is one, the underlying error as
 * its cause.
 *
 * <p>
 * The message renders as {@code [CODE] detail: cause} when a cause is present
 * and {@code [CODE] detail} otherwise.
 * </p>
 */
public class TogoMQException extends RuntimeException {

    private final ErrorCode code;
    private final String detail;

    public TogoMQException(ErrorCode code, String detail) {
        this(code, detail, null);
    }

    public TogoMQException(ErrorCode code, String detail, Throwable cause) {
        super(render(code, detail, cause), cause);
        this.code = code;
        this.detail = detail;
    }

    public ErrorCode code() {
        return code;
    }

    /**
     * @return the description without the code prefix or the cause
     */
    public String detail() {
        return detail;
    }

    private static String render(ErrorCode code, String detail, Throwable cause) {
        if (cause == null) {
            return "[" + code.code() + "] " + detail;
        }
        String underlying = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return "[" + code.code() + "] " + detail + ": " + underlying;
    }
}

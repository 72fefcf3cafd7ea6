package com.sqlframe.error;

/**
 * Base class for failures raised by the query-to-frame pipeline.
 *
 * <p>Each subclass carries a stable code that the HTTP layer reports to clients.
 */
public abstract class FrameQueryException extends RuntimeException {
    private final String code;

    protected FrameQueryException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected FrameQueryException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

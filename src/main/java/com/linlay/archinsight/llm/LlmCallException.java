package com.linlay.archinsight.llm;

/**
 * Failure of a single generation call. Carries the provider error code and HTTP status when the
 * transport exposed them, so retry classification can match on either.
 */
public class LlmCallException extends RuntimeException {

    private final String code;
    private final Integer status;

    public LlmCallException(String message) {
        this(message, null, null, null);
    }

    public LlmCallException(String message, String code, Integer status) {
        this(message, code, status, null);
    }

    public LlmCallException(String message, String code, Integer status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public Integer status() {
        return status;
    }
}

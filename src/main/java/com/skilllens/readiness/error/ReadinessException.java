package com.skilllens.readiness.error;

/**
 * Base of all engine failures. Every subclass is a synchronous validation
 * failure and is never worth retrying.
 */
public abstract class ReadinessException extends RuntimeException {
    private final String code;

    protected ReadinessException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

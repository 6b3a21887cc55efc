package com.pagecraft.service;

/**
 * Base class for domain failures surfaced to callers.
 *
 * Every subclass carries a stable {@link #getCode() code} that survives the
 * trip through the HTTP layer, so clients can branch on it without parsing
 * messages.
 */
public abstract class DesignerException extends RuntimeException {

    private final String code;

    protected DesignerException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

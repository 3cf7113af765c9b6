package com.cine.explorer.common.exception;

import lombok.Getter;

/**
 * Base exception class for all catalog build and lookup failures.
 * Carries an error code that the web layer maps to a response status.
 */
@Getter
public abstract class BaseCineException extends RuntimeException {

    private final String errorCode;

    protected BaseCineException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseCineException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseCineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}

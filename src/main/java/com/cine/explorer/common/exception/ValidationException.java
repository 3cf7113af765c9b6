package com.cine.explorer.common.exception;

/**
 * Exception for invalid query parameters.
 */
public class ValidationException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

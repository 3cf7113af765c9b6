package com.cine.explorer.common.exception;

/**
 * Exception thrown when a document is not found in the destination collection.
 */
public class EntityNotFoundException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-001";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String entityType, String identifier) {
        super(String.format("%s with identifier %s not found", entityType, identifier));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

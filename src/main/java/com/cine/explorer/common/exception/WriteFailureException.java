package com.cine.explorer.common.exception;

import lombok.Getter;

/**
 * A batch write to the destination collection failed.
 * Batches committed before this one are not rolled back.
 */
@Getter
public class WriteFailureException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-WRT-001";

    private final String collection;
    private final int batchNumber;

    public WriteFailureException(String collection, int batchNumber, Throwable cause) {
        super(String.format("Batch %d into '%s' failed: %s", batchNumber, collection,
                cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.collection = collection;
        this.batchNumber = batchNumber;
    }

    public WriteFailureException(String message, Throwable cause) {
        super(message, cause);
        this.collection = null;
        this.batchNumber = -1;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

package com.cine.explorer.common.exception;

import com.cine.explorer.enums.Relation;
import lombok.Getter;

/**
 * A required source relation could not be read. Always fatal for the build.
 */
@Getter
public class SourceUnavailableException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SRC-001";

    private final Relation relation;

    public SourceUnavailableException(Relation relation, Throwable cause) {
        super(String.format("Relation %s could not be read: %s", relation.tableName(),
                cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.relation = relation;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

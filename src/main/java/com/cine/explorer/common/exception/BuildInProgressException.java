package com.cine.explorer.common.exception;

public class BuildInProgressException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BLD-003";

    public BuildInProgressException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

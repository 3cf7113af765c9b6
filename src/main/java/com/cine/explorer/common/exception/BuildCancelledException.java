package com.cine.explorer.common.exception;

import com.cine.explorer.enums.BuildPhase;
import lombok.Getter;

@Getter
public class BuildCancelledException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BLD-002";

    private final BuildPhase phase;

    public BuildCancelledException(BuildPhase phase) {
        super(String.format("Build cancelled before %s", phase));
        this.phase = phase;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

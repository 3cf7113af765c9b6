package com.cine.explorer.common.exception;

import com.cine.explorer.enums.BuildPhase;
import lombok.Getter;

/**
 * Raised when a build aborts. Names the phase that was running and keeps the
 * underlying failure as cause.
 */
@Getter
public class BuildFailedException extends BaseCineException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BLD-001";

    private final BuildPhase phase;

    public BuildFailedException(BuildPhase phase, Throwable cause) {
        super(codeOf(cause), String.format("Build failed during %s: %s", phase,
                cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.phase = phase;
    }

    private static String codeOf(Throwable cause) {
        return cause instanceof BaseCineException bce ? bce.getErrorCode() : DEFAULT_ERROR_CODE;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}

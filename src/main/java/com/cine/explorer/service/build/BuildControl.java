package com.cine.explorer.service.build;

import com.cine.explorer.common.exception.BuildCancelledException;
import com.cine.explorer.enums.BuildPhase;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks the running phase of one build and carries its cancellation flag.
 * Cancellation is cooperative and only observed between phases.
 */
@Slf4j
public final class BuildControl {

    private volatile boolean cancelled;
    private volatile BuildPhase phase = BuildPhase.LOAD_PERSONS;

    public void enter(BuildPhase next) {
        if (cancelled) {
            throw new BuildCancelledException(next);
        }
        phase = next;
        log.info("Phase {}", next);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public BuildPhase phase() {
        return phase;
    }
}

package com.cine.explorer.enums;

public enum PublishMode {
    /**
     * Drop the target collection and write into it directly. Readers can
     * observe an empty or partial collection while the load runs.
     */
    DROP_AND_REPLACE,
    /**
     * Write into a staging collection, index it, then rename it over the
     * target in one step.
     */
    STAGED_SWAP
}

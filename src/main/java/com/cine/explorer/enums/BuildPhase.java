package com.cine.explorer.enums;

/**
 * Build phases in execution order. Each one completes before the next starts.
 */
public enum BuildPhase {
    LOAD_PERSONS,
    INDEX_RATINGS,
    INDEX_GENRES,
    INDEX_DIRECTORS,
    INDEX_WRITERS,
    ASSEMBLE_CAST,
    READ_MOVIES,
    ASSEMBLE_DOCUMENTS,
    BULK_LOAD,
    SECONDARY_INDEXES,
    PUBLISH,
    VERIFY
}

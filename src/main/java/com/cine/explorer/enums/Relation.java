package com.cine.explorer.enums;

/**
 * Source relations read by the movies_complete build.
 */
public enum Relation {
    MOVIES("MOVIES"),
    RATINGS("RATINGS"),
    GENRES("GENRES"),
    PERSONS("PERSONS"),
    DIRECTORS("DIRECTORS"),
    WRITERS("WRITERS"),
    PRINCIPALS("PRINCIPALS"),
    CHARACTERS("CHARACTERS");

    private final String tableName;

    Relation(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}

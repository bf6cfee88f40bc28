package com.sqlmcp.stats;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a reported row count came from.
 */
public enum RowCountSource {
    STATISTICS,
    COUNT,
    UNAVAILABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}

package com.sqlmcp.stats;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchKind {
    TABLE_NAME("table-name"),
    COLUMN_NAME("column-name");

    private final String wireName;

    MatchKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

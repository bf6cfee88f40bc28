package com.sqlmcp.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strongest key a column takes part in. Declaration order is precedence order.
 */
public enum KeyRole {
    PRIMARY,
    UNIQUE,
    FOREIGN,
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public KeyRole strongest(KeyRole other) {
        return ordinal() <= other.ordinal() ? this : other;
    }
}

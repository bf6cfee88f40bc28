package com.sqlmcp.stats;

import java.util.Locale;

/**
 * Which names a search looks at.
 */
public enum SearchType {
    TABLE,
    COLUMN,
    BOTH;

    /**
     * Resolves the wire value, defaulting to {@link #BOTH} when none is given.
     */
    public static SearchType fromWire(String wireValue) {
        if (wireValue == null) {
            return BOTH;
        }
        return valueOf(wireValue.toUpperCase(Locale.ROOT));
    }

    boolean includesTables() {
        return this != COLUMN;
    }

    boolean includesColumns() {
        return this != TABLE;
    }
}

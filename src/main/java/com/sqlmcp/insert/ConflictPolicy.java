package com.sqlmcp.insert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What an insert does with a row whose conflict key already exists.
 */
public enum ConflictPolicy {
    /** Abort the whole batch. */
    FAIL,
    /** Skip the row and keep going. */
    IGNORE,
    /** Overwrite the existing row's non-key columns. */
    UPDATE;

    /**
     * Resolves the wire value. {@code replace} is accepted as another name for {@link #UPDATE};
     * no value means {@link #FAIL}.
     */
    public static ConflictPolicy fromWire(String wireValue) {
        if (wireValue == null) {
            return FAIL;
        }
        String lowerValue = wireValue.toLowerCase(Locale.ROOT);
        if ("replace".equals(lowerValue)) {
            return UPDATE;
        }
        return valueOf(lowerValue.toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

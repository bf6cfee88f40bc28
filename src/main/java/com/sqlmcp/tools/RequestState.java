package com.sqlmcp.tools;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a single tool call. Transitions only move forward:
 * received, validated, executing, then one of completed or failed; rejected ends a call before execution.
 */
public enum RequestState {
    RECEIVED,
    VALIDATED,
    EXECUTING,
    COMPLETED,
    REJECTED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == FAILED;
    }
}

package com.sqlmcp.db;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health of a pooled connection, or of the pool as a whole.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    DEAD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}

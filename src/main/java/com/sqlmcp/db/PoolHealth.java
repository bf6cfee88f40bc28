package com.sqlmcp.db;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Snapshot produced by {@link ConnectionManager#checkHealth()}.
 *
 * @param status Aggregate status of the pool
 * @param poolSize Configured fixed pool size
 * @param healthy Connections that answered the liveness probe
 * @param degraded Leased connections currently flagged as suspect
 * @param dead Connections that failed the probe or could not be obtained
 * @param replaced Dead connections replaced by a fresh, probed connection
 * @param inUse Connections leased to tool calls and therefore not probed
 * @param checkedAt When the check finished
 * @param lastError Message of the last failure seen, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PoolHealth(
        HealthState status,
        int poolSize,
        int healthy,
        int degraded,
        int dead,
        int replaced,
        int inUse,
        Instant checkedAt,
        String lastError
) {
}

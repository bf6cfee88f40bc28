package com.sqlmcp.db;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of the check_connection tool: reachability, pool health and, when reachable, server identity.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionStatus(
        boolean connected,
        HealthState status,
        PoolHealth pool,
        ServerInfo server
) {
}

package com.sqlmcp.db;

/**
 * Database server identity as reported by the driver metadata.
 */
public record ServerInfo(
        String databaseProduct,
        String databaseVersion,
        String driverName,
        String driverVersion,
        String databaseName,
        String databaseType
) {
}

package com.sqlmcp.backup;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A completed table copy.
 *
 * @param schema Schema holding both tables, null where the database has none
 * @param sourceTable Table that was copied
 * @param backupTable Name of the new table
 * @param rowsCopied Rows written to the new table
 * @param completedAt When the copy committed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackupSpec(String schema, String sourceTable, String backupTable, long rowsCopied, Instant completedAt) {
}

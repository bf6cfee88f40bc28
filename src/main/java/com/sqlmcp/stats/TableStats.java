package com.sqlmcp.stats;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Size metrics for one table.
 *
 * @param schema Schema of the table, null where the database has none
 * @param table Table name
 * @param rowCount Row count, null when unavailable
 * @param rowCountSource Whether the count came from maintained statistics or a bounded count
 * @param storageBytes Storage used by data and indexes, null where the database does not report it
 * @param indexCount Number of distinct indexes
 * @param lastModified Last modification or analysis time as ISO-8601 text, where available
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableStats(
        String schema,
        String table,
        Long rowCount,
        RowCountSource rowCountSource,
        Long storageBytes,
        int indexCount,
        String lastModified
) {
}

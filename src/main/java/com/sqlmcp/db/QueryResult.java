package com.sqlmcp.db;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by a read statement together with the limit that bounded them.
 *
 * @param columns Column descriptors in result order
 * @param rows Row maps keyed by column label, in result order
 * @param rowCount Number of rows returned
 * @param truncated Whether more rows existed beyond the effective limit
 * @param effectiveLimit The row limit that was applied
 * @param statement The statement text actually executed
 * @param executionTimeMs Wall clock execution time in milliseconds
 */
public record QueryResult(
        List<ColumnMeta> columns,
        List<Map<String, Object>> rows,
        int rowCount,
        boolean truncated,
        int effectiveLimit,
        String statement,
        long executionTimeMs
) {
    public QueryResult {
        if (columns == null) {
            throw new IllegalArgumentException("Columns cannot be null");
        }
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        if (rowCount != rows.size()) {
            throw new IllegalArgumentException("Row count must match the number of rows");
        }
        if (rowCount > effectiveLimit) {
            throw new IllegalArgumentException("Row count cannot exceed the effective limit");
        }
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * Name and database type of a result column.
     */
    public record ColumnMeta(String name, String type) {
    }
}

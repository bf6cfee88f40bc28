package com.sqlmcp.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * A table descriptor with a row count and a few example rows.
 *
 * @param table Structure of the table
 * @param rowCount Exact row count, null when counting timed out
 * @param sampleRows Up to the requested number of rows, in database order
 */
public record TableDetails(
        TableDescriptor table,
        @JsonInclude(JsonInclude.Include.ALWAYS) Long rowCount,
        List<Map<String, Object>> sampleRows
) {
    public TableDetails {
        sampleRows = List.copyOf(sampleRows);
    }
}

package com.sqlmcp.insert;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqlmcp.db.JdbcValues;
import com.sqlmcp.tools.ToolRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch of rows for one table.
 *
 * @param table Target table name as the caller gave it
 * @param rows Column to value maps in caller order; values may be null
 * @param policy Conflict policy
 * @param conflictKey Caller supplied conflict key columns, empty to use the table's own key
 */
public record InsertRequest(String table, List<Map<String, Object>> rows, ConflictPolicy policy, List<String> conflictKey) {
    public InsertRequest {
        List<Map<String, Object>> rowCopies = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            rowCopies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(rowCopies);
        conflictKey = conflictKey == null ? List.of() : List.copyOf(conflictKey);
    }

    /**
     * Builds the request from arguments that already passed the safety policy.
     */
    public static InsertRequest from(ToolRequest toolRequest) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode rowNode : toolRequest.argument("rows")) {
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> rowFields = rowNode.fields();
            while (rowFields.hasNext()) {
                Map.Entry<String, JsonNode> rowField = rowFields.next();
                row.put(rowField.getKey(), JdbcValues.fromJson(rowField.getValue()));
            }
            rows.add(row);
        }

        List<String> conflictKey = new ArrayList<>();
        for (JsonNode keyNode : toolRequest.argument("conflict_key")) {
            conflictKey.add(keyNode.asText());
        }

        return new InsertRequest(
                toolRequest.argument("table").asText(),
                rows,
                ConflictPolicy.fromWire(toolRequest.text("conflict_policy").orElse(null)),
                conflictKey);
    }
}

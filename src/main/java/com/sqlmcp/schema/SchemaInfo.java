package com.sqlmcp.schema;

import java.util.List;

/**
 * Every visible table and view, sorted by schema then name.
 */
public record SchemaInfo(String database, int tableCount, List<TableDescriptor> tables) {
    public SchemaInfo {
        tables = List.copyOf(tables);
    }
}

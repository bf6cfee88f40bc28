package com.sqlmcp.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;

/**
 * Structure of one table or view as read from the metadata catalog.
 * Indexes are null unless they were asked for; columns are null only in a schema listing that left them out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableDescriptor(
        String schema,
        String name,
        String type,
        List<ColumnInfo> columns,
        List<String> primaryKey,
        List<ForeignKeyInfo> foreignKeys,
        List<IndexInfo> indexes
) {
    public TableDescriptor {
        columns = columns == null ? null : List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        foreignKeys = List.copyOf(foreignKeys);
        indexes = indexes == null ? null : List.copyOf(indexes);
    }

    public TableDescriptor withoutColumns() {
        return new TableDescriptor(schema, name, type, null, primaryKey, foreignKeys, indexes);
    }

    public Optional<ColumnInfo> column(String columnName) {
        if (columns == null) {
            return Optional.empty();
        }
        return columns.stream().filter(columnInfo -> columnInfo.name().equalsIgnoreCase(columnName)).findFirst();
    }
}

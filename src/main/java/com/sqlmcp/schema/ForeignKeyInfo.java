package com.sqlmcp.schema;

/**
 * One column of a foreign key and the column it references.
 */
public record ForeignKeyInfo(String name, String column, String referencedTable, String referencedColumn) {
}

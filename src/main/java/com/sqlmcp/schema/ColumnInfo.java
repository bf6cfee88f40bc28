package com.sqlmcp.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param name Column name as stored in the catalog
 * @param type Declared type name
 * @param size Declared size or precision, null when the driver reports none
 * @param nullable Whether the column accepts NULL
 * @param keyRole Strongest key this column belongs to
 * @param defaultValue Column default expression, if any
 * @param autoIncrement Whether the database generates values for this column
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnInfo(
        String name,
        String type,
        Integer size,
        boolean nullable,
        KeyRole keyRole,
        String defaultValue,
        boolean autoIncrement
) {
    ColumnInfo withKeyRole(KeyRole newKeyRole) {
        return new ColumnInfo(name, type, size, nullable, newKeyRole, defaultValue, autoIncrement);
    }
}

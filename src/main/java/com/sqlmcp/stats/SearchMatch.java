package com.sqlmcp.stats;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A table or column whose name contains the search term.
 *
 * @param schema Schema of the table, null where the database has none
 * @param table Table name
 * @param column Column name, null for a table-name match
 * @param kind What matched
 * @param matched The matching part of the name in its stored case
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchMatch(String schema, String table, String column, MatchKind kind, String matched) {
}

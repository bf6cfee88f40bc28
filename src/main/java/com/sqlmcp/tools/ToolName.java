package com.sqlmcp.tools;

import java.util.Optional;

/**
 * The fixed catalog of tools. Nothing outside this list is callable.
 */
public enum ToolName {
    EXECUTE_QUERY("execute_query",
            "Execute a read-only SELECT query with bound parameters. A row limit is always applied."),
    GET_SCHEMA("get_schema",
            "List tables and views with their columns, keys and optionally indexes."),
    GET_TABLE_INFO("get_table_info",
            "Describe one table in detail, including its row count and a few sample rows."),
    EXPLAIN_QUERY("explain_query",
            "Return the estimated execution plan of a read-only query without running it."),
    CHECK_CONNECTION("check_connection",
            "Check database reachability and report connection pool health."),
    GET_TABLE_STATS("get_table_stats",
            "Report row counts, storage size and index counts for one table or all tables."),
    SEARCH_TABLES("search_tables",
            "Find tables and columns whose names contain a literal search term."),
    BACKUP_TABLE("backup_table",
            "Copy a table's structure and rows into a new table in the same database."),
    INSERT_DATA("insert_data",
            "Insert a bounded batch of rows with an explicit conflict policy, atomically.");

    private final String wireName;
    private final String description;

    ToolName(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    /**
     * Resolves a tool by its wire name. Matching is exact.
     */
    public static Optional<ToolName> fromWireName(String wireName) {
        for (ToolName toolName : values()) {
            if (toolName.wireName.equals(wireName)) {
                return Optional.of(toolName);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}

package com.sqlmcp.schema;

import com.sqlmcp.tools.ToolException;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Answers structural questions from the database's metadata catalog. Implementations never read table
 * contents except for the explicitly bounded samples and counts of {@link #getTableInfo}.
 */
public interface SchemaInspector {

    /**
     * Lists the tables and views visible to the connected credential, excluding system schemas.
     */
    List<TableRef> listTables(Connection dbConn) throws ToolException;

    /**
     * Finds a table by name, ignoring case where the database folds unquoted names.
     */
    Optional<TableRef> resolveTable(Connection dbConn, String tableName) throws ToolException;

    /**
     * Same as {@link #resolveTable} but fails with {@code NotFound} when the table is not visible.
     */
    TableRef requireTable(Connection dbConn, String tableName) throws ToolException;

    TableDescriptor describe(Connection dbConn, TableRef tableRef, boolean includeIndexes) throws ToolException;

    /**
     * Columns of a resolved table in ordinal order, without key roles.
     */
    List<ColumnInfo> listColumns(Connection dbConn, TableRef tableRef) throws ToolException;

    List<IndexInfo> listIndexes(Connection dbConn, TableRef tableRef) throws ToolException;

    /**
     * Describes every visible table, or only the named one when a filter is given.
     */
    SchemaInfo getSchema(Connection dbConn, String tableFilter, boolean includeColumns, boolean includeIndexes) throws ToolException;

    TableDetails getTableInfo(Connection dbConn, String tableName, int sampleRows) throws ToolException;
}

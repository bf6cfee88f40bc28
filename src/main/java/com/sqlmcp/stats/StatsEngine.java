package com.sqlmcp.stats;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.db.JdbcValues;
import com.sqlmcp.db.SqlErrors;
import com.sqlmcp.db.SqlNames;
import com.sqlmcp.schema.ColumnInfo;
import com.sqlmcp.schema.IndexInfo;
import com.sqlmcp.schema.JdbcSchemaInspector;
import com.sqlmcp.schema.SchemaInspector;
import com.sqlmcp.schema.TableRef;
import com.sqlmcp.tools.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Table size metrics and name search.
 *
 * <p>Row counts and storage sizes come from the database's own statistics where the dialect keeps them.
 * When statistics are missing or were never gathered the row count falls back to {@code COUNT(*)} under
 * the stats timeout; a count that does not finish in time is reported as unavailable.
 */
public class StatsEngine {
    private static final Logger logger = LoggerFactory.getLogger(StatsEngine.class);

    private static final String POSTGRES_STATS = """
            SELECT CASE WHEN COALESCE(s.last_analyze, s.last_autoanalyze) IS NULL THEN NULL ELSE s.n_live_tup END AS row_count,
                   pg_total_relation_size(c.oid) AS storage_bytes,
                   GREATEST(s.last_analyze, s.last_autoanalyze) AS last_modified
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_stat_user_tables s ON s.relid = c.oid
            WHERE n.nspname = ? AND c.relname = ?""";

    private static final String MYSQL_STATS = """
            SELECT TABLE_ROWS AS row_count,
                   DATA_LENGTH + INDEX_LENGTH AS storage_bytes,
                   COALESCE(UPDATE_TIME, CREATE_TIME) AS last_modified
            FROM information_schema.TABLES
            WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?""";

    private static final String SQLSERVER_STATS = """
            SELECT (SELECT SUM(p.rows) FROM sys.partitions p
                    WHERE p.object_id = t.object_id AND p.index_id IN (0, 1)) AS row_count,
                   (SELECT SUM(a.total_pages) * 8192 FROM sys.partitions p
                    JOIN sys.allocation_units a ON a.container_id = p.partition_id
                    WHERE p.object_id = t.object_id) AS storage_bytes,
                   t.modify_date AS last_modified
            FROM sys.tables t
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            WHERE s.name = ? AND t.name = ?""";

    private static final String ORACLE_STATS = """
            SELECT t.NUM_ROWS AS row_count,
                   (SELECT SUM(g.BYTES) FROM ALL_SEGMENTS g
                    WHERE g.OWNER = t.OWNER AND g.SEGMENT_NAME = t.TABLE_NAME) AS storage_bytes,
                   t.LAST_ANALYZED AS last_modified
            FROM ALL_TABLES t
            WHERE t.OWNER = ? AND t.TABLE_NAME = ?""";

    private final ConfigParams configParams;
    private final SchemaInspector schemaInspector;

    public StatsEngine(ConfigParams configParams, SchemaInspector schemaInspector) {
        this.configParams = configParams;
        this.schemaInspector = schemaInspector;
    }

    /**
     * Returns metrics for the named table, or for every visible table when no name is given.
     *
     * @param dbConn Leased connection
     * @param tableName Table to report on, or null for all tables
     * @return One entry per table, sorted by schema then name
     * @throws ToolException NotFound for an unknown table, or the classified driver failure
     */
    public List<TableStats> getTableStats(Connection dbConn, String tableName) throws ToolException {
        List<TableRef> tableRefs = tableName == null
                ? schemaInspector.listTables(dbConn)
                : List.of(schemaInspector.requireTable(dbConn, tableName));

        String quoteString;
        try {
            quoteString = SqlNames.quoteString(dbConn.getMetaData());
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read identifier quote");
        }

        List<TableStats> tableStats = new ArrayList<>();
        for (TableRef tableRef : tableRefs) {
            tableStats.add(statsFor(dbConn, tableRef, quoteString));
        }
        return tableStats;
    }

    private TableStats statsFor(Connection dbConn, TableRef tableRef, String quoteString) throws ToolException {
        Long rowCount = null;
        Long storageBytes = null;
        String lastModified = null;
        RowCountSource rowCountSource = RowCountSource.STATISTICS;

        String statsQuery = tableRef.isView() ? null : statisticsQuery(configParams.getDatabaseType());
        if (statsQuery != null) {
            try (PreparedStatement prepStmt = dbConn.prepareStatement(statsQuery)) {
                prepStmt.setQueryTimeout(configParams.statsTimeoutSeconds());
                prepStmt.setString(1, tableRef.schema() != null ? tableRef.schema() : tableRef.catalog());
                prepStmt.setString(2, tableRef.name());
                try (ResultSet resultSet = prepStmt.executeQuery()) {
                    if (resultSet.next()) {
                        rowCount = nullableLong(resultSet, "row_count");
                        storageBytes = nullableLong(resultSet, "storage_bytes");
                        Object modifiedValue = JdbcValues.read(resultSet, resultSet.findColumn("last_modified"));
                        lastModified = modifiedValue == null ? null : modifiedValue.toString();
                    }
                }
            } catch (SQLException e) {
                if (SqlErrors.isConnectionError(e)) {
                    throw SqlErrors.classify(e, "read table statistics");
                }
                logger.warn("Statistics for {} not readable, falling back to a bounded count: {}",
                        tableRef.name(), e.getMessage());
            }
        }

        if (rowCount == null) {
            rowCount = JdbcSchemaInspector.countRows(dbConn, tableRef.qualifiedName(quoteString),
                    configParams.statsTimeoutSeconds());
            rowCountSource = rowCount == null ? RowCountSource.UNAVAILABLE : RowCountSource.COUNT;
        }

        List<IndexInfo> indexes = schemaInspector.listIndexes(dbConn, tableRef);
        return new TableStats(tableRef.schema(), tableRef.name(), rowCount, rowCountSource, storageBytes,
                indexes.size(), lastModified);
    }

    static String statisticsQuery(String dbType) {
        return switch (dbType) {
            case "postgresql" -> POSTGRES_STATS;
            case "mysql", "mariadb" -> MYSQL_STATS;
            case "sqlserver" -> SQLSERVER_STATS;
            case "oracle" -> ORACLE_STATS;
            default -> null;
        };
    }

    private static Long nullableLong(ResultSet resultSet, String columnLabel) throws SQLException {
        long columnValue = resultSet.getLong(columnLabel);
        return resultSet.wasNull() ? null : columnValue;
    }

    /**
     * Case-insensitive literal substring search over table and column names.
     *
     * @param dbConn Leased connection
     * @param searchTerm The literal term; it is never placed in SQL
     * @param searchType Which names to look at
     * @return Matches ordered by table, with the table's own match ahead of its columns
     */
    public List<SearchMatch> searchTables(Connection dbConn, String searchTerm, SearchType searchType) throws ToolException {
        String lowerTerm = searchTerm.toLowerCase(Locale.ROOT);
        List<SearchMatch> searchMatches = new ArrayList<>();

        for (TableRef tableRef : schemaInspector.listTables(dbConn)) {
            if (searchType.includesTables()) {
                String matched = matchedPart(tableRef.name(), lowerTerm);
                if (matched != null) {
                    searchMatches.add(new SearchMatch(tableRef.schema(), tableRef.name(), null, MatchKind.TABLE_NAME, matched));
                }
            }
            if (searchType.includesColumns()) {
                for (ColumnInfo columnInfo : schemaInspector.listColumns(dbConn, tableRef)) {
                    String matched = matchedPart(columnInfo.name(), lowerTerm);
                    if (matched != null) {
                        searchMatches.add(new SearchMatch(tableRef.schema(), tableRef.name(), columnInfo.name(),
                                MatchKind.COLUMN_NAME, matched));
                    }
                }
            }
        }
        logger.debug("Search for '{}' over {} names found {} matches", searchTerm, searchType, searchMatches.size());
        return searchMatches;
    }

    private static String matchedPart(String name, String lowerTerm) {
        int matchStart = name.toLowerCase(Locale.ROOT).indexOf(lowerTerm);
        return matchStart < 0 ? null : name.substring(matchStart, matchStart + lowerTerm.length());
    }
}

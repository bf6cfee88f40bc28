package com.sqlmcp.schema;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.db.QueryExecutor;
import com.sqlmcp.db.SqlErrors;
import com.sqlmcp.db.SqlNames;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link SchemaInspector} backed by {@link DatabaseMetaData}.
 */
public class JdbcSchemaInspector implements SchemaInspector {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaInspector.class);
    private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};
    private static final Set<String> SYSTEM_SCHEMAS = Set.of(
            "information_schema", "pg_catalog", "pg_toast", "sys", "mysql", "performance_schema",
            "system", "ctxsys", "mdsys", "outln", "xdb", "sysibm", "syscat", "sysstat", "systools");
    static final Comparator<TableRef> TABLE_ORDER = Comparator
            .comparing((TableRef tableRef) -> Objects.toString(tableRef.schema(), ""))
            .thenComparing(TableRef::name);

    private final ConfigParams configParams;
    private final QueryExecutor queryExecutor;

    public JdbcSchemaInspector(ConfigParams configParams) {
        this.configParams = configParams;
        this.queryExecutor = new QueryExecutor(configParams);
    }

    @Override
    public List<TableRef> listTables(Connection dbConn) throws ToolException {
        try {
            return readTables(dbConn.getMetaData(), dbConn.getCatalog(), "%");
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "list tables");
        }
    }

    private List<TableRef> readTables(DatabaseMetaData metaData, String catalog, String namePattern) throws SQLException {
        List<TableRef> tableRefs = new ArrayList<>();
        try (ResultSet resultSet = metaData.getTables(catalog, null, namePattern, TABLE_TYPES)) {
            while (resultSet.next()) {
                String schemaName = resultSet.getString("TABLE_SCHEM");
                if (isSystemSchema(schemaName)) {
                    continue;
                }
                tableRefs.add(new TableRef(
                        resultSet.getString("TABLE_CAT"),
                        schemaName,
                        resultSet.getString("TABLE_NAME"),
                        normalizeTableType(resultSet.getString("TABLE_TYPE"))));
            }
        }
        tableRefs.sort(TABLE_ORDER);
        return tableRefs;
    }

    static boolean isSystemSchema(String schemaName) {
        return schemaName != null && SYSTEM_SCHEMAS.contains(schemaName.toLowerCase(Locale.ROOT));
    }

    // H2 2.x reports BASE TABLE
    private static String normalizeTableType(String tableType) {
        if (tableType == null) {
            return "TABLE";
        }
        String upperType = tableType.toUpperCase(Locale.ROOT);
        return upperType.contains("VIEW") ? "VIEW" : "TABLE";
    }

    @Override
    public Optional<TableRef> resolveTable(Connection dbConn, String tableName) throws ToolException {
        try {
            DatabaseMetaData metaData = dbConn.getMetaData();
            String searchEscape = metaData.getSearchStringEscape();

            // unquoted names fold to upper case on some databases and lower case on others
            Set<String> nameCandidates = new LinkedHashSet<>();
            nameCandidates.add(tableName);
            nameCandidates.add(tableName.toUpperCase(Locale.ROOT));
            nameCandidates.add(tableName.toLowerCase(Locale.ROOT));

            List<TableRef> tableMatches = new ArrayList<>();
            for (String nameCandidate : nameCandidates) {
                for (TableRef tableRef : readTables(metaData, dbConn.getCatalog(), SqlNames.escapePattern(nameCandidate, searchEscape))) {
                    if (tableRef.name().equalsIgnoreCase(tableName) && !tableMatches.contains(tableRef)) {
                        tableMatches.add(tableRef);
                    }
                }
            }
            if (tableMatches.isEmpty()) {
                return Optional.empty();
            }

            String currentSchema = currentSchema(dbConn);
            Comparator<TableRef> preference = Comparator
                    .comparing((TableRef tableRef) -> !tableRef.name().equals(tableName))
                    .thenComparing(tableRef -> currentSchema == null || !currentSchema.equalsIgnoreCase(tableRef.schema()))
                    .thenComparing(TABLE_ORDER);
            tableMatches.sort(preference);
            return Optional.of(tableMatches.get(0));
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "resolve table");
        }
    }

    private static String currentSchema(Connection dbConn) {
        try {
            return dbConn.getSchema();
        } catch (SQLException | AbstractMethodError e) {
            logger.debug("Current schema not available: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public TableRef requireTable(Connection dbConn, String tableName) throws ToolException {
        return resolveTable(dbConn, tableName).orElseThrow(() -> new ToolException(ErrorKind.NOT_FOUND,
                ResourceManager.getErrorMessage("schema.table.not.found", tableName)));
    }

    @Override
    public TableDescriptor describe(Connection dbConn, TableRef tableRef, boolean includeIndexes) throws ToolException {
        try {
            DatabaseMetaData metaData = dbConn.getMetaData();
            List<String> primaryKey = tableRef.isView() ? List.of() : readPrimaryKey(metaData, tableRef);
            List<ForeignKeyInfo> foreignKeys = tableRef.isView() ? List.of() : readForeignKeys(metaData, tableRef);
            List<IndexInfo> indexes = tableRef.isView() ? List.of() : readIndexes(metaData, tableRef);

            List<ColumnInfo> columns = new ArrayList<>();
            for (ColumnInfo columnInfo : readColumns(metaData, tableRef)) {
                columns.add(columnInfo.withKeyRole(keyRoleOf(columnInfo.name(), primaryKey, foreignKeys, indexes)));
            }

            return new TableDescriptor(tableRef.schema(), tableRef.name(), tableRef.type(), columns, primaryKey,
                    foreignKeys, includeIndexes ? indexes : null);
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "describe table " + tableRef.name());
        }
    }

    @Override
    public List<ColumnInfo> listColumns(Connection dbConn, TableRef tableRef) throws ToolException {
        try {
            return readColumns(dbConn.getMetaData(), tableRef);
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read columns of " + tableRef.name());
        }
    }

    @Override
    public List<IndexInfo> listIndexes(Connection dbConn, TableRef tableRef) throws ToolException {
        if (tableRef.isView()) {
            return List.of();
        }
        try {
            return readIndexes(dbConn.getMetaData(), tableRef);
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read indexes of " + tableRef.name());
        }
    }

    private List<ColumnInfo> readColumns(DatabaseMetaData metaData, TableRef tableRef) throws SQLException {
        String searchEscape = metaData.getSearchStringEscape();
        Map<Integer, ColumnInfo> columnsByPosition = new TreeMap<>();
        try (ResultSet resultSet = metaData.getColumns(tableRef.catalog(),
                SqlNames.escapePattern(tableRef.schema(), searchEscape),
                SqlNames.escapePattern(tableRef.name(), searchEscape), "%")) {
            int fallbackPosition = 0;
            while (resultSet.next()) {
                if (!tableRef.name().equals(resultSet.getString("TABLE_NAME"))) {
                    continue;
                }
                fallbackPosition++;
                int ordinalPosition = resultSet.getInt("ORDINAL_POSITION");
                int columnSize = resultSet.getInt("COLUMN_SIZE");
                boolean sizeReported = !resultSet.wasNull();
                columnsByPosition.put(ordinalPosition > 0 ? ordinalPosition : fallbackPosition, new ColumnInfo(
                        resultSet.getString("COLUMN_NAME"),
                        resultSet.getString("TYPE_NAME"),
                        sizeReported ? columnSize : null,
                        resultSet.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                        KeyRole.NONE,
                        resultSet.getString("COLUMN_DEF"),
                        "YES".equalsIgnoreCase(resultSet.getString("IS_AUTOINCREMENT"))));
            }
        }
        return new ArrayList<>(columnsByPosition.values());
    }

    private List<String> readPrimaryKey(DatabaseMetaData metaData, TableRef tableRef) throws SQLException {
        Map<Short, String> keyColumns = new TreeMap<>();
        try (ResultSet resultSet = metaData.getPrimaryKeys(tableRef.catalog(), tableRef.schema(), tableRef.name())) {
            while (resultSet.next()) {
                keyColumns.put(resultSet.getShort("KEY_SEQ"), resultSet.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(keyColumns.values());
    }

    private List<ForeignKeyInfo> readForeignKeys(DatabaseMetaData metaData, TableRef tableRef) throws SQLException {
        List<ForeignKeyInfo> foreignKeys = new ArrayList<>();
        try (ResultSet resultSet = metaData.getImportedKeys(tableRef.catalog(), tableRef.schema(), tableRef.name())) {
            while (resultSet.next()) {
                foreignKeys.add(new ForeignKeyInfo(
                        resultSet.getString("FK_NAME"),
                        resultSet.getString("FKCOLUMN_NAME"),
                        resultSet.getString("PKTABLE_NAME"),
                        resultSet.getString("PKCOLUMN_NAME")));
            }
        }
        foreignKeys.sort(Comparator.comparing((ForeignKeyInfo foreignKey) -> Objects.toString(foreignKey.name(), ""))
                .thenComparing(ForeignKeyInfo::column));
        return foreignKeys;
    }

    // columns are grouped by index name in key order
    private List<IndexInfo> readIndexes(DatabaseMetaData metaData, TableRef tableRef) throws SQLException {
        Map<String, Map<Short, String>> indexColumns = new TreeMap<>();
        Map<String, Boolean> uniqueIndexes = new LinkedHashMap<>();
        try (ResultSet resultSet = metaData.getIndexInfo(tableRef.catalog(), tableRef.schema(), tableRef.name(), false, true)) {
            while (resultSet.next()) {
                String indexName = resultSet.getString("INDEX_NAME");
                String columnName = resultSet.getString("COLUMN_NAME");
                if (indexName == null || columnName == null
                        || resultSet.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
                    continue;
                }
                indexColumns.computeIfAbsent(indexName, k -> new TreeMap<>())
                        .put(resultSet.getShort("ORDINAL_POSITION"), columnName);
                uniqueIndexes.put(indexName, !resultSet.getBoolean("NON_UNIQUE"));
            }
        }

        List<IndexInfo> indexes = new ArrayList<>();
        for (Map.Entry<String, Map<Short, String>> indexEntry : indexColumns.entrySet()) {
            indexes.add(new IndexInfo(indexEntry.getKey(), new ArrayList<>(indexEntry.getValue().values()),
                    uniqueIndexes.getOrDefault(indexEntry.getKey(), false)));
        }
        return indexes;
    }

    private static KeyRole keyRoleOf(String columnName, List<String> primaryKey,
                                     List<ForeignKeyInfo> foreignKeys, List<IndexInfo> indexes) {
        KeyRole keyRole = KeyRole.NONE;
        if (primaryKey.contains(columnName)) {
            keyRole = keyRole.strongest(KeyRole.PRIMARY);
        }
        for (IndexInfo indexInfo : indexes) {
            if (indexInfo.unique() && indexInfo.columns().equals(List.of(columnName))) {
                keyRole = keyRole.strongest(KeyRole.UNIQUE);
            }
        }
        for (ForeignKeyInfo foreignKey : foreignKeys) {
            if (foreignKey.column().equals(columnName)) {
                keyRole = keyRole.strongest(KeyRole.FOREIGN);
            }
        }
        return keyRole;
    }

    @Override
    public SchemaInfo getSchema(Connection dbConn, String tableFilter, boolean includeColumns,
                                boolean includeIndexes) throws ToolException {
        List<TableRef> tableRefs = tableFilter == null
                ? listTables(dbConn)
                : List.of(requireTable(dbConn, tableFilter));

        List<TableDescriptor> descriptors = new ArrayList<>();
        for (TableRef tableRef : tableRefs) {
            TableDescriptor descriptor = describe(dbConn, tableRef, includeIndexes);
            descriptors.add(includeColumns ? descriptor : descriptor.withoutColumns());
        }
        logger.debug("Schema read: {} tables", descriptors.size());

        try {
            return new SchemaInfo(dbConn.getCatalog(), descriptors.size(), descriptors);
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read catalog name");
        }
    }

    @Override
    public TableDetails getTableInfo(Connection dbConn, String tableName, int sampleRows) throws ToolException {
        TableRef tableRef = requireTable(dbConn, tableName);
        TableDescriptor descriptor = describe(dbConn, tableRef, true);

        String qualifiedName;
        try {
            qualifiedName = tableRef.qualifiedName(SqlNames.quoteString(dbConn.getMetaData()));
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read identifier quote");
        }

        Long rowCount = countRows(dbConn, qualifiedName, configParams.statsTimeoutSeconds());
        List<Map<String, Object>> samples = sampleRows == 0
                ? List.of()
                : queryExecutor.execute(dbConn, "SELECT * FROM " + qualifiedName, List.of(), sampleRows).rows();
        return new TableDetails(descriptor, rowCount, samples);
    }

    /**
     * Exact row count bounded by a timeout.
     *
     * @return The count, or null when the count did not finish in time; the connection is then suspect
     * @throws ToolException for any failure other than the timeout
     */
    public static Long countRows(Connection dbConn, String qualifiedName, int timeoutSeconds) throws ToolException {
        try (PreparedStatement prepStmt = dbConn.prepareStatement("SELECT COUNT(*) FROM " + qualifiedName)) {
            prepStmt.setQueryTimeout(timeoutSeconds);
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                return resultSet.next() ? resultSet.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            ToolException classified = SqlErrors.classify(e, "count rows of " + qualifiedName);
            if (classified.getErrorKind() == ErrorKind.TIMEOUT) {
                logger.warn("Row count of {} exceeded {}s, reporting it as unavailable", qualifiedName, timeoutSeconds);
                return null;
            }
            throw classified;
        }
    }
}

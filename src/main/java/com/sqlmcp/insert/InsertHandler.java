package com.sqlmcp.insert;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.db.JdbcValues;
import com.sqlmcp.db.SqlErrors;
import com.sqlmcp.db.SqlNames;
import com.sqlmcp.schema.ColumnInfo;
import com.sqlmcp.schema.IndexInfo;
import com.sqlmcp.schema.SchemaInspector;
import com.sqlmcp.schema.TableDescriptor;
import com.sqlmcp.schema.TableRef;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes a bounded batch of rows in one transaction under a conflict policy.
 *
 * <p>Rows are checked against the table's columns before anything is written. Conflicts are detected
 * with a lookup on the conflict key, which is the caller's key when given, otherwise the primary key,
 * otherwise the first unique index covered by the rows. Two rows of the same batch sharing a key
 * value reject the whole batch. Any failure rolls the batch back completely.
 */
public class InsertHandler {
    private static final Logger logger = LoggerFactory.getLogger(InsertHandler.class);

    private final ConfigParams configParams;
    private final SchemaInspector schemaInspector;

    public InsertHandler(ConfigParams configParams, SchemaInspector schemaInspector) {
        this.configParams = configParams;
        this.schemaInspector = schemaInspector;
    }

    /**
     * Inserts the rows of the request.
     *
     * @param dbConn Leased connection; its auto-commit mode is restored afterwards
     * @param insertRequest Rows, policy and optional conflict key
     * @return Inserted, updated and skipped counts of the committed batch
     * @throws ToolException NotFound, SchemaMismatch, ConflictKeyMissing, RowConflict or a classified driver failure
     */
    public InsertOutcome insertRows(Connection dbConn, InsertRequest insertRequest) throws ToolException {
        TableRef tableRef = schemaInspector.requireTable(dbConn, insertRequest.table());
        TableDescriptor descriptor = schemaInspector.describe(dbConn, tableRef, true);

        List<String> rowColumns = resolveRowColumns(descriptor, insertRequest.rows());
        List<String> conflictKey = resolveConflictKey(descriptor, rowColumns, insertRequest);
        if (!conflictKey.isEmpty()) {
            rejectDuplicateKeys(insertRequest.rows(), rowColumns, conflictKey);
        }

        String quoteString;
        try {
            quoteString = SqlNames.quoteString(dbConn.getMetaData());
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read identifier quote");
        }

        logger.info("SECURITY: Inserting {} rows into {} with conflict policy {}",
                insertRequest.rows().size(), tableRef.name(), insertRequest.policy().wireName());
        InsertOutcome insertOutcome = writeBatch(dbConn, tableRef.qualifiedName(quoteString), quoteString,
                tableRef.name(), rowColumns, conflictKey, insertRequest);
        logger.info("Insert into {} committed: inserted={} updated={} skipped={}", tableRef.name(),
                insertOutcome.inserted(), insertOutcome.updated(), insertOutcome.skipped());
        return insertOutcome;
    }

    /**
     * Maps the batch's row keys onto the table's stored column names, in the order of the first row.
     * Every row must use the same columns and cover every column that has no way to get a value of its own.
     */
    static List<String> resolveRowColumns(TableDescriptor descriptor, List<Map<String, Object>> rows) throws ToolException {
        Set<String> firstRowKeys = lowerKeys(rows.get(0).keySet());
        for (int rowIndex = 1; rowIndex < rows.size(); rowIndex++) {
            if (!lowerKeys(rows.get(rowIndex).keySet()).equals(firstRowKeys)) {
                throw mismatch("insert.rows.inconsistent", rowIndex + 1);
            }
        }

        List<String> rowColumns = new ArrayList<>();
        for (String rowKey : rows.get(0).keySet()) {
            ColumnInfo columnInfo = descriptor.column(rowKey)
                    .orElseThrow(() -> mismatch("insert.column.unknown", rowKey, descriptor.name()));
            rowColumns.add(columnInfo.name());
        }

        for (ColumnInfo columnInfo : descriptor.columns()) {
            boolean required = !columnInfo.nullable() && columnInfo.defaultValue() == null && !columnInfo.autoIncrement();
            if (required && !rowColumns.contains(columnInfo.name())) {
                throw mismatch("insert.column.required.missing", columnInfo.name());
            }
        }
        return rowColumns;
    }

    /**
     * Picks the conflict key. An empty result is only possible under the fail policy.
     */
    static List<String> resolveConflictKey(TableDescriptor descriptor, List<String> rowColumns,
                                           InsertRequest insertRequest) throws ToolException {
        List<String> conflictKey;
        if (!insertRequest.conflictKey().isEmpty()) {
            conflictKey = new ArrayList<>();
            for (String keyColumn : insertRequest.conflictKey()) {
                conflictKey.add(descriptor.column(keyColumn)
                        .orElseThrow(() -> mismatch("insert.column.unknown", keyColumn, descriptor.name()))
                        .name());
            }
        } else {
            conflictKey = tableKey(descriptor, rowColumns).orElse(List.of());
        }

        if (conflictKey.isEmpty()) {
            if (insertRequest.policy() != ConflictPolicy.FAIL) {
                throw new ToolException(ErrorKind.CONFLICT_KEY_MISSING, ResourceManager.getErrorMessage(
                        "insert.conflict.key.missing", descriptor.name(), insertRequest.policy().wireName()));
            }
            return conflictKey;
        }
        for (String keyColumn : conflictKey) {
            if (!rowColumns.contains(keyColumn)) {
                if (insertRequest.policy() == ConflictPolicy.FAIL && insertRequest.conflictKey().isEmpty()) {
                    // generated keys cannot collide with existing rows
                    return List.of();
                }
                throw mismatch("insert.conflict.key.absent", keyColumn);
            }
        }
        return conflictKey;
    }

    private static Optional<List<String>> tableKey(TableDescriptor descriptor, List<String> rowColumns) {
        if (!descriptor.primaryKey().isEmpty()) {
            return Optional.of(descriptor.primaryKey());
        }
        if (descriptor.indexes() == null) {
            return Optional.empty();
        }
        return descriptor.indexes().stream()
                .filter(IndexInfo::unique)
                .map(IndexInfo::columns)
                .filter(rowColumns::containsAll)
                .findFirst();
    }

    private static void rejectDuplicateKeys(List<Map<String, Object>> rows, List<String> rowColumns,
                                            List<String> conflictKey) throws ToolException {
        Set<List<Object>> seenKeys = new HashSet<>();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            List<Object> keyValues = keyValues(rows.get(rowIndex), rowColumns, conflictKey);
            if (!seenKeys.add(comparableKey(keyValues))) {
                throw new ToolException(ErrorKind.ROW_CONFLICT, ResourceManager.getErrorMessage(
                        "insert.batch.duplicate.key", rowIndex + 1, String.join(", ", conflictKey)));
            }
        }
    }

    private InsertOutcome writeBatch(Connection dbConn, String qualifiedName, String quoteString, String tableName,
                                     List<String> rowColumns, List<String> conflictKey,
                                     InsertRequest insertRequest) throws ToolException {
        List<String> updateColumns = rowColumns.stream()
                .filter(columnName -> !conflictKey.contains(columnName))
                .collect(Collectors.toList());
        String keyPredicate = conflictKey.stream()
                .map(columnName -> SqlNames.quote(columnName, quoteString) + " = ?")
                .collect(Collectors.joining(" AND "));

        String insertSql = "INSERT INTO " + qualifiedName + " ("
                + rowColumns.stream().map(columnName -> SqlNames.quote(columnName, quoteString)).collect(Collectors.joining(", "))
                + ") VALUES (" + rowColumns.stream().map(columnName -> "?").collect(Collectors.joining(", ")) + ")";
        String existsSql = "SELECT "
                + conflictKey.stream().map(columnName -> SqlNames.quote(columnName, quoteString)).collect(Collectors.joining(", "))
                + " FROM " + qualifiedName + " WHERE " + keyPredicate;
        String updateSql = "UPDATE " + qualifiedName + " SET "
                + updateColumns.stream().map(columnName -> SqlNames.quote(columnName, quoteString) + " = ?")
                .collect(Collectors.joining(", "))
                + " WHERE " + keyPredicate;

        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        Set<List<Object>> touchedKeys = new HashSet<>();
        boolean originalAutoCommit = true;
        try {
            originalAutoCommit = dbConn.getAutoCommit();
            dbConn.setAutoCommit(false);

            try (PreparedStatement insertStmt = prepare(dbConn, insertSql);
                 PreparedStatement existsStmt = conflictKey.isEmpty() ? null : prepare(dbConn, existsSql);
                 PreparedStatement updateStmt = updateColumns.isEmpty() || conflictKey.isEmpty() ? null : prepare(dbConn, updateSql)) {

                for (int rowIndex = 0; rowIndex < insertRequest.rows().size(); rowIndex++) {
                    Map<String, Object> row = byColumn(insertRequest.rows().get(rowIndex), rowColumns);
                    List<Object> keyValues = conflictKey.stream().map(row::get).collect(Collectors.toList());

                    List<Object> storedKey = existsStmt == null ? null : storedKey(existsStmt, keyValues);
                    if (storedKey != null) {
                        // the match may be a row this batch already wrote, e.g. under a case-insensitive collation
                        if (!touchedKeys.add(comparableKey(storedKey))) {
                            throw new ToolException(ErrorKind.ROW_CONFLICT, ResourceManager.getErrorMessage(
                                    "insert.batch.duplicate.key", rowIndex + 1, String.join(", ", conflictKey)));
                        }
                        switch (insertRequest.policy()) {
                            case FAIL -> throw new ToolException(ErrorKind.ROW_CONFLICT, ResourceManager.getErrorMessage(
                                    "insert.row.conflict", rowIndex + 1, String.join(", ", conflictKey)));
                            case IGNORE -> skipped++;
                            case UPDATE -> {
                                if (updateStmt == null) {
                                    skipped++;
                                } else {
                                    bindAll(updateStmt, updateColumns.stream().map(row::get).collect(Collectors.toList()), keyValues);
                                    updateStmt.executeUpdate();
                                    updated++;
                                }
                            }
                        }
                        continue;
                    }

                    bindAll(insertStmt, rowColumns.stream().map(row::get).collect(Collectors.toList()), List.of());
                    insertStmt.executeUpdate();
                    inserted++;
                    if (existsStmt != null) {
                        touchedKeys.add(comparableKey(keyValues));
                    }
                }
            }

            dbConn.commit();
            return new InsertOutcome(tableName, insertRequest.policy(), inserted, updated, skipped, conflictKey);
        } catch (ToolException e) {
            rollback(dbConn, e);
            throw e;
        } catch (SQLException e) {
            ToolException failure = SqlErrors.isIntegrityViolation(e)
                    ? new ToolException(ErrorKind.ROW_CONFLICT,
                    ResourceManager.getErrorMessage("insert.constraint.violated", tableName, e.getMessage()), e)
                    : SqlErrors.classify(e, "insert into " + tableName);
            rollback(dbConn, failure);
            throw failure;
        } finally {
            try {
                dbConn.setAutoCommit(originalAutoCommit);
            } catch (SQLException e) {
                logger.warn("Could not restore auto-commit after insert: {}", e.getMessage());
            }
        }
    }

    private PreparedStatement prepare(Connection dbConn, String sqlText) throws SQLException {
        PreparedStatement prepStmt = dbConn.prepareStatement(sqlText);
        prepStmt.setQueryTimeout(configParams.queryTimeoutSeconds());
        return prepStmt;
    }

    /**
     * Looks the key up and returns it as stored, or null when no row has it.
     */
    private static List<Object> storedKey(PreparedStatement existsStmt, List<Object> keyValues) throws SQLException {
        bindAll(existsStmt, keyValues, List.of());
        try (ResultSet resultSet = existsStmt.executeQuery()) {
            if (!resultSet.next()) {
                return null;
            }
            List<Object> storedValues = new ArrayList<>(keyValues.size());
            for (int columnIndex = 1; columnIndex <= keyValues.size(); columnIndex++) {
                storedValues.add(JdbcValues.read(resultSet, columnIndex));
            }
            return storedValues;
        }
    }

    private static void bindAll(PreparedStatement prepStmt, List<Object> leadingValues, List<Object> trailingValues)
            throws SQLException {
        int paramIndex = 1;
        for (Object paramValue : leadingValues) {
            JdbcValues.bind(prepStmt, paramIndex++, paramValue);
        }
        for (Object paramValue : trailingValues) {
            JdbcValues.bind(prepStmt, paramIndex++, paramValue);
        }
    }

    private static void rollback(Connection dbConn, ToolException failure) {
        try {
            dbConn.rollback();
            logger.warn("Insert batch rolled back: {}", failure.getMessage());
        } catch (SQLException e) {
            logger.error("Rollback of insert batch failed: {}", e.getMessage());
            failure.addSuppressed(e);
        }
    }

    // row keys may differ in case from the stored column names
    private static Map<String, Object> byColumn(Map<String, Object> row, List<String> rowColumns) {
        Map<String, Object> lowerRow = new LinkedHashMap<>();
        row.forEach((rowKey, rowValue) -> lowerRow.put(rowKey.toLowerCase(Locale.ROOT), rowValue));
        Map<String, Object> columnRow = new LinkedHashMap<>();
        for (String columnName : rowColumns) {
            columnRow.put(columnName, lowerRow.get(columnName.toLowerCase(Locale.ROOT)));
        }
        return columnRow;
    }

    private static List<Object> keyValues(Map<String, Object> row, List<String> rowColumns, List<String> conflictKey) {
        Map<String, Object> columnRow = byColumn(row, rowColumns);
        return conflictKey.stream().map(columnRow::get).collect(Collectors.toList());
    }

    /**
     * Key values as compared between rows of one batch. Numbers compare by value, so 50 and 50.0 are the same key.
     */
    static List<Object> comparableKey(List<Object> keyValues) {
        List<Object> comparable = new ArrayList<>(keyValues.size());
        for (Object keyValue : keyValues) {
            if (keyValue instanceof Number number) {
                comparable.add(new BigDecimal(number.toString()).stripTrailingZeros());
            } else {
                comparable.add(keyValue);
            }
        }
        return comparable;
    }

    private static Set<String> lowerKeys(Set<String> rowKeys) {
        return rowKeys.stream().map(rowKey -> rowKey.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    private static ToolException mismatch(String messageKey, Object... messageArgs) {
        return new ToolException(ErrorKind.SCHEMA_MISMATCH, ResourceManager.getErrorMessage(messageKey, messageArgs));
    }
}

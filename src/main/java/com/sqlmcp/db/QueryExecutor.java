package com.sqlmcp.db;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.tools.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an already validated read statement on a leased connection and collects a bounded result.
 * One extra row is fetched beyond the limit so truncation can be reported.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);
    private final ConfigParams configParams;

    public QueryExecutor(ConfigParams configParams) {
        this.configParams = configParams;
    }

    /**
     * Executes a read statement with bound parameters.
     *
     * @param dbConn    Leased connection
     * @param statement Validated statement text with positional placeholders
     * @param paramList Values bound in placeholder order
     * @param rowLimit  Maximum rows to return
     * @return QueryResult with columns, rows and the truncation flag
     * @throws ToolException if the statement fails or times out
     */
    public QueryResult execute(Connection dbConn, String statement, List<Object> paramList, int rowLimit) throws ToolException {
        long startTime = System.currentTimeMillis();

        try (PreparedStatement prepStmt = dbConn.prepareStatement(statement)) {
            prepStmt.setMaxRows(rowLimit + 1);
            prepStmt.setQueryTimeout(configParams.queryTimeoutSeconds());

            for (int i = 0; i < paramList.size(); i++) {
                JdbcValues.bind(prepStmt, i + 1, paramList.get(i));
            }
            logger.debug("Executing query with {} parameters and limit {}: {}", paramList.size(), rowLimit, abbreviate(statement));

            try (ResultSet resultSet = prepStmt.executeQuery()) {
                ResultSetMetaData metaData = resultSet.getMetaData();
                int columnCount = metaData.getColumnCount();

                List<QueryResult.ColumnMeta> resultColumns = new ArrayList<>();
                List<String> rowKeys = new ArrayList<>();
                for (int i = 1; i <= columnCount; i++) {
                    String columnLabel = metaData.getColumnLabel(i);
                    resultColumns.add(new QueryResult.ColumnMeta(columnLabel, metaData.getColumnTypeName(i)));
                    rowKeys.add(uniqueKey(columnLabel, rowKeys));
                }

                List<Map<String, Object>> resultRows = new ArrayList<>();
                boolean truncated = false;
                while (resultSet.next()) {
                    if (resultRows.size() == rowLimit) {
                        truncated = true;
                        break;
                    }
                    Map<String, Object> currRow = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        currRow.put(rowKeys.get(i - 1), JdbcValues.read(resultSet, i));
                    }
                    resultRows.add(currRow);
                }

                long executionTime = System.currentTimeMillis() - startTime;
                logger.debug("Query completed in {}ms, returned {} rows, truncated={}", executionTime, resultRows.size(), truncated);
                return new QueryResult(resultColumns, resultRows, resultRows.size(), truncated, rowLimit, statement, executionTime);
            }
        } catch (SQLException e) {
            long executionTime = System.currentTimeMillis() - startTime;
            logger.error("Query execution failed after {}ms: {} - Error: {}", executionTime, abbreviate(statement), e.getMessage());
            throw SqlErrors.classify(e, "execute query");
        }
    }

    // Joins can return the same label twice; later ones get a numeric suffix
    private static String uniqueKey(String columnLabel, List<String> existingKeys) {
        if (!existingKeys.contains(columnLabel)) {
            return columnLabel;
        }
        int suffix = 2;
        while (existingKeys.contains(columnLabel + "_" + suffix)) {
            suffix++;
        }
        return columnLabel + "_" + suffix;
    }

    static String abbreviate(String sqlText) {
        return sqlText.length() > 200 ? sqlText.substring(0, 200) + "..." : sqlText;
    }
}

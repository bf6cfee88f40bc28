package com.sqlmcp.explain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.db.JdbcValues;
import com.sqlmcp.db.SqlErrors;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.JsonSupport;
import com.sqlmcp.tools.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the database for its plan of a read statement and normalizes it into a {@link PlanStep} tree.
 * The statement itself is never executed for results.
 */
public class ExplainEngine {
    private static final Logger logger = LoggerFactory.getLogger(ExplainEngine.class);
    private static final Pattern PLAN_COMMENT = Pattern.compile("/\\*\\s*(.*?)\\s*\\*/", Pattern.DOTALL);

    private final ConfigParams configParams;

    public ExplainEngine(ConfigParams configParams) {
        this.configParams = configParams;
    }

    /**
     * Explains a statement that already passed the read-only policy.
     *
     * @param dbConn Leased connection
     * @param statement Statement text with positional placeholders
     * @param paramList Values bound in placeholder order
     * @return The normalized plan
     * @throws ToolException PlanUnavailable when the database cannot produce a plan, or a classified
     *                       connection or timeout failure
     */
    public ExplainPlan explain(Connection dbConn, String statement, List<Object> paramList) throws ToolException {
        String dbType = configParams.getDatabaseType();
        logger.debug("Explaining {} statement: {}", dbType, statement);
        try {
            PlanStep root = switch (dbType) {
                case "postgresql" -> explainPostgres(dbConn, statement, paramList);
                case "sqlserver" -> explainSqlServer(dbConn, statement, paramList);
                case "mysql", "mariadb" -> explainMySql(dbConn, statement, paramList);
                case "sqlite" -> explainSqlite(dbConn, statement, paramList);
                case "oracle" -> explainOracle(dbConn, statement, paramList);
                default -> explainText(dbConn, statement, paramList);
            };
            return new ExplainPlan(statement, dbType, root);
        } catch (SQLException e) {
            ToolException classified = SqlErrors.classify(e, "explain query");
            if (classified.getErrorKind().isConnectionSuspect() || classified.getErrorKind() == ErrorKind.PERMISSION_DENIED) {
                throw classified;
            }
            logger.warn("Plan not available for {} statement: {}", dbType, e.getMessage());
            throw new ToolException(ErrorKind.PLAN_UNAVAILABLE,
                    ResourceManager.getErrorMessage("explain.plan.unavailable", dbType, e.getMessage()), e);
        }
    }

    private PreparedStatement prepare(Connection dbConn, String sqlText, List<Object> paramList) throws SQLException {
        PreparedStatement prepStmt = dbConn.prepareStatement(sqlText);
        prepStmt.setQueryTimeout(configParams.queryTimeoutSeconds());
        for (int i = 0; i < paramList.size(); i++) {
            JdbcValues.bind(prepStmt, i + 1, paramList.get(i));
        }
        return prepStmt;
    }

    private PlanStep explainPostgres(Connection dbConn, String statement, List<Object> paramList) throws SQLException, ToolException {
        try (PreparedStatement prepStmt = prepare(dbConn, "EXPLAIN (FORMAT JSON) " + statement, paramList);
             ResultSet resultSet = prepStmt.executeQuery()) {
            StringBuilder planJson = new StringBuilder();
            while (resultSet.next()) {
                planJson.append(resultSet.getString(1));
            }
            return parsePostgresPlan(planJson.toString());
        }
    }

    static PlanStep parsePostgresPlan(String planJson) throws ToolException {
        try {
            JsonNode planNode = JsonSupport.mapper().readTree(planJson).path(0).path("Plan");
            if (planNode.isMissingNode()) {
                throw new ToolException(ErrorKind.PLAN_UNAVAILABLE,
                        ResourceManager.getErrorMessage("explain.plan.unreadable", "postgresql"));
            }
            return postgresStep(planNode);
        } catch (JsonProcessingException e) {
            throw new ToolException(ErrorKind.PLAN_UNAVAILABLE,
                    ResourceManager.getErrorMessage("explain.plan.unreadable", "postgresql"), e);
        }
    }

    private static PlanStep postgresStep(JsonNode planNode) {
        List<PlanStep> children = new ArrayList<>();
        for (JsonNode childNode : planNode.path("Plans")) {
            children.add(postgresStep(childNode));
        }
        String relationName = planNode.path("Relation Name").asText(null);
        String indexName = planNode.path("Index Name").asText(null);
        String detail = relationName == null ? indexName : indexName == null ? relationName : relationName + " using " + indexName;
        return new PlanStep(
                planNode.path("Node Type").asText("Unknown"),
                planNode.has("Total Cost") ? planNode.get("Total Cost").asDouble() : null,
                planNode.has("Plan Rows") ? planNode.get("Plan Rows").asDouble() : null,
                detail,
                children);
    }

    private PlanStep explainSqlServer(Connection dbConn, String statement, List<Object> paramList) throws SQLException {
        try (Statement showplanStmt = dbConn.createStatement()) {
            showplanStmt.execute("SET SHOWPLAN_ALL ON");
            try (PreparedStatement prepStmt = prepare(dbConn, statement, paramList);
                 ResultSet resultSet = prepStmt.executeQuery()) {
                List<PlanRow> planRows = new ArrayList<>();
                while (resultSet.next()) {
                    String physicalOp = resultSet.getString("PhysicalOp");
                    String operation = physicalOp != null ? physicalOp : "Statement";
                    planRows.add(new PlanRow(
                            resultSet.getInt("NodeId"),
                            resultSet.getInt("Parent"),
                            PlanStep.leaf(operation,
                                    nullableDouble(resultSet, "TotalSubtreeCost"),
                                    nullableDouble(resultSet, "EstimateRows"),
                                    trimToNull(resultSet.getString("StmtText")))));
                }
                return buildTree(planRows, "Statement");
            } finally {
                showplanStmt.execute("SET SHOWPLAN_ALL OFF");
            }
        }
    }

    private PlanStep explainMySql(Connection dbConn, String statement, List<Object> paramList) throws SQLException {
        try (PreparedStatement prepStmt = prepare(dbConn, "EXPLAIN " + statement, paramList);
             ResultSet resultSet = prepStmt.executeQuery()) {
            List<PlanStep> children = new ArrayList<>();
            while (resultSet.next()) {
                String accessType = resultSet.getString("type");
                String operation = resultSet.getString("select_type") + (accessType == null ? "" : " " + accessType);
                String detail = "table=" + resultSet.getString("table")
                        + ", key=" + resultSet.getString("key")
                        + ", extra=" + resultSet.getString("Extra");
                children.add(PlanStep.leaf(operation, null, nullableDouble(resultSet, "rows"), detail));
            }
            return new PlanStep("Query", null, null, null, children);
        }
    }

    private PlanStep explainSqlite(Connection dbConn, String statement, List<Object> paramList) throws SQLException {
        try (PreparedStatement prepStmt = prepare(dbConn, "EXPLAIN QUERY PLAN " + statement, paramList);
             ResultSet resultSet = prepStmt.executeQuery()) {
            List<PlanRow> planRows = new ArrayList<>();
            while (resultSet.next()) {
                String detail = resultSet.getString("detail");
                planRows.add(new PlanRow(resultSet.getInt("id"), resultSet.getInt("parent"),
                        PlanStep.leaf(firstWord(detail), null, null, detail)));
            }
            return buildTree(planRows, "Query");
        }
    }

    private PlanStep explainOracle(Connection dbConn, String statement, List<Object> paramList) throws SQLException {
        String statementId = "mcp_" + UUID.randomUUID().toString().replace("-", "").substring(0, 20);
        try (PreparedStatement explainStmt = prepare(dbConn,
                "EXPLAIN PLAN SET STATEMENT_ID = '" + statementId + "' FOR " + statement, paramList)) {
            explainStmt.execute();
        }
        try (PreparedStatement planStmt = dbConn.prepareStatement(
                "SELECT ID, PARENT_ID, OPERATION, OPTIONS, OBJECT_NAME, COST, CARDINALITY "
                        + "FROM PLAN_TABLE WHERE STATEMENT_ID = ? ORDER BY ID")) {
            planStmt.setString(1, statementId);
            try (ResultSet resultSet = planStmt.executeQuery()) {
                List<PlanRow> planRows = new ArrayList<>();
                while (resultSet.next()) {
                    String options = resultSet.getString("OPTIONS");
                    String operation = resultSet.getString("OPERATION") + (options == null ? "" : " " + options);
                    int parentId = resultSet.getInt("PARENT_ID");
                    planRows.add(new PlanRow(resultSet.getInt("ID"), resultSet.wasNull() ? -1 : parentId,
                            PlanStep.leaf(operation, nullableDouble(resultSet, "COST"),
                                    nullableDouble(resultSet, "CARDINALITY"), resultSet.getString("OBJECT_NAME"))));
                }
                return buildTree(planRows, "Statement");
            }
        } finally {
            try (PreparedStatement cleanupStmt = dbConn.prepareStatement("DELETE FROM PLAN_TABLE WHERE STATEMENT_ID = ?")) {
                cleanupStmt.setString(1, statementId);
                cleanupStmt.executeUpdate();
            } catch (SQLException e) {
                logger.warn("Could not clear plan rows for {}: {}", statementId, e.getMessage());
            }
        }
    }

    /**
     * Plain {@code EXPLAIN}. A single text column, as H2 returns, becomes one step whose children are the
     * access notes the database writes as comments; several columns become one child per row.
     */
    private PlanStep explainText(Connection dbConn, String statement, List<Object> paramList) throws SQLException {
        try (PreparedStatement prepStmt = prepare(dbConn, "EXPLAIN " + statement, paramList);
             ResultSet resultSet = prepStmt.executeQuery()) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();

            if (columnCount == 1) {
                StringBuilder planText = new StringBuilder();
                while (resultSet.next()) {
                    if (planText.length() > 0) {
                        planText.append('\n');
                    }
                    planText.append(resultSet.getString(1));
                }
                return parseTextPlan(planText.toString());
            }

            List<PlanStep> children = new ArrayList<>();
            while (resultSet.next()) {
                Map<String, Object> rowValues = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    rowValues.put(metaData.getColumnLabel(i), JdbcValues.read(resultSet, i));
                }
                children.add(PlanStep.leaf("Step", null, null, rowValues.toString()));
            }
            return new PlanStep("Query", null, null, null, children);
        }
    }

    static PlanStep parseTextPlan(String planText) {
        List<PlanStep> children = new ArrayList<>();
        Matcher commentMatcher = PLAN_COMMENT.matcher(planText);
        while (commentMatcher.find()) {
            String note = commentMatcher.group(1);
            children.add(PlanStep.leaf(firstWord(note), null, null, note));
        }
        return new PlanStep("Query", null, null, planText.trim(), children);
    }

    /**
     * Node of a plan reported as flat rows linked by parent id.
     */
    record PlanRow(int id, int parentId, PlanStep step) {
    }

    /**
     * Links flat plan rows into a tree. Rows whose parent is not among the rows are roots; several roots
     * are gathered under a synthetic step.
     */
    static PlanStep buildTree(List<PlanRow> planRows, String rootOperation) {
        Map<Integer, PlanRow> rowsById = new LinkedHashMap<>();
        for (PlanRow planRow : planRows) {
            rowsById.put(planRow.id(), planRow);
        }
        List<PlanStep> roots = new ArrayList<>();
        for (PlanRow planRow : planRows) {
            if (planRow.parentId() == planRow.id() || !rowsById.containsKey(planRow.parentId())) {
                roots.add(attachChildren(planRow, planRows));
            }
        }
        if (roots.size() == 1) {
            return roots.get(0);
        }
        return new PlanStep(rootOperation, null, null, null, roots);
    }

    private static PlanStep attachChildren(PlanRow parentRow, List<PlanRow> planRows) {
        List<PlanStep> children = new ArrayList<>();
        for (PlanRow planRow : planRows) {
            if (planRow.parentId() == parentRow.id() && planRow.id() != parentRow.id()) {
                children.add(attachChildren(planRow, planRows));
            }
        }
        return parentRow.step().withChildren(children);
    }

    private static Double nullableDouble(ResultSet resultSet, String columnLabel) throws SQLException {
        double columnValue = resultSet.getDouble(columnLabel);
        return resultSet.wasNull() ? null : columnValue;
    }

    private static String firstWord(String text) {
        if (text == null || text.isBlank()) {
            return "Step";
        }
        String trimmed = text.trim();
        int spaceIndex = trimmed.indexOf(' ');
        return spaceIndex < 0 ? trimmed : trimmed.substring(0, spaceIndex);
    }

    private static String trimToNull(String text) {
        return text == null || text.isBlank() ? null : text.trim();
    }
}

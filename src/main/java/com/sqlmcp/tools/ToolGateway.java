package com.sqlmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqlmcp.backup.BackupManager;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.db.ConnectionManager;
import com.sqlmcp.db.PooledConnection;
import com.sqlmcp.db.QueryExecutor;
import com.sqlmcp.db.SqlErrors;
import com.sqlmcp.explain.ExplainEngine;
import com.sqlmcp.insert.InsertHandler;
import com.sqlmcp.insert.InsertRequest;
import com.sqlmcp.safety.SafetyDecision;
import com.sqlmcp.safety.SafetyPolicyEnforcer;
import com.sqlmcp.schema.JdbcSchemaInspector;
import com.sqlmcp.schema.SchemaInspector;
import com.sqlmcp.schema.TableDetails;
import com.sqlmcp.stats.RowCountSource;
import com.sqlmcp.stats.SearchMatch;
import com.sqlmcp.stats.SearchType;
import com.sqlmcp.stats.StatsEngine;
import com.sqlmcp.stats.TableStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a tool call through the safety policy to the component that serves it and turns the outcome into
 * a {@link ToolResponse}. Each call moves through received, validated and executing to exactly one of
 * completed, rejected or failed. Nothing is executed for a call the policy rejected.
 *
 * <p>The gateway keeps no state between calls. Every call that touches the database borrows one pooled
 * connection for its whole duration and returns it before the response is built.
 */
public class ToolGateway {
    private static final Logger logger = LoggerFactory.getLogger(ToolGateway.class);

    private final ConnectionManager connectionManager;
    private final SafetyPolicyEnforcer policyEnforcer;
    private final SchemaInspector schemaInspector;
    private final QueryExecutor queryExecutor;
    private final StatsEngine statsEngine;
    private final BackupManager backupManager;
    private final InsertHandler insertHandler;
    private final ExplainEngine explainEngine;

    public ToolGateway(ConnectionManager connectionManager) {
        this(connectionManager, Clock.systemDefaultZone());
    }

    public ToolGateway(ConnectionManager connectionManager, Clock clock) {
        ConfigParams configParams = connectionManager.getConfig();
        this.connectionManager = connectionManager;
        this.policyEnforcer = new SafetyPolicyEnforcer(configParams);
        this.schemaInspector = new JdbcSchemaInspector(configParams);
        this.queryExecutor = new QueryExecutor(configParams);
        this.statsEngine = new StatsEngine(configParams, schemaInspector);
        this.backupManager = new BackupManager(configParams, schemaInspector, clock);
        this.insertHandler = new InsertHandler(configParams, schemaInspector);
        this.explainEngine = new ExplainEngine(configParams);
    }

    /**
     * Handles one tool call.
     *
     * @param toolName Wire name of the tool
     * @param rawArguments Arguments as received; anything but an object counts as no arguments
     * @return The terminal response; this method does not throw for tool level failures
     */
    public ToolResponse dispatch(String toolName, JsonNode rawArguments) {
        logger.debug("Tool call {}: {}", RequestState.RECEIVED.wireName(), toolName);

        ToolName resolvedTool = ToolName.fromWireName(toolName).orElse(null);
        if (resolvedTool == null) {
            logger.warn("Rejected call to unknown tool: {}", toolName);
            return ToolResponse.rejected(toolName, ErrorKind.UNKNOWN_TOOL,
                    ResourceManager.getErrorMessage("tool.unknown", toolName));
        }

        ToolRequest toolRequest = ToolRequest.of(resolvedTool, rawArguments);
        SafetyDecision decision = policyEnforcer.evaluate(toolRequest);
        if (!decision.allowed()) {
            logger.debug("Tool call {}: {} ({})", RequestState.REJECTED.wireName(), resolvedTool, decision.rejectionKind().wireCode());
            return ToolResponse.rejected(resolvedTool.wireName(), decision.rejectionKind(), decision.reason());
        }
        logger.debug("Tool call {}: {}", RequestState.VALIDATED.wireName(), resolvedTool);

        long startTime = System.currentTimeMillis();
        try {
            logger.debug("Tool call {}: {}", RequestState.EXECUTING.wireName(), resolvedTool);
            Object resultValue = resolvedTool == ToolName.CHECK_CONNECTION
                    ? connectionManager.checkConnection()
                    : executeWithLease(decision);
            JsonNode resultNode = JsonSupport.mapper().valueToTree(resultValue);
            logger.debug("Tool call {}: {} in {}ms", RequestState.COMPLETED.wireName(), resolvedTool,
                    System.currentTimeMillis() - startTime);
            return ToolResponse.completed(resolvedTool, resultNode);
        } catch (ToolException e) {
            logger.warn("Tool call {}: {} ({}) {}", RequestState.FAILED.wireName(), resolvedTool,
                    e.getErrorKind().wireCode(), e.getMessage());
            return ToolResponse.failed(resolvedTool, e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in tool {}", resolvedTool, e);
            return ToolResponse.failed(resolvedTool, ErrorKind.DATABASE_ERROR,
                    ResourceManager.getErrorMessage("tool.unexpected.failure", resolvedTool.wireName(), String.valueOf(e.getMessage())));
        }
    }

    private Object executeWithLease(SafetyDecision decision) throws ToolException {
        try (PooledConnection lease = connectionManager.acquire()) {
            try {
                return execute(decision, lease);
            } catch (ToolException e) {
                if (leavesConnectionSuspect(e)) {
                    lease.markDegraded();
                }
                throw e;
            }
        }
    }

    static boolean leavesConnectionSuspect(ToolException e) {
        if (e.getErrorKind().isConnectionSuspect()) {
            return true;
        }
        return e.getCause() instanceof SQLException sqlException && SqlErrors.kindOf(sqlException).isConnectionSuspect();
    }

    private Object execute(SafetyDecision decision, PooledConnection lease) throws ToolException {
        Connection dbConn = lease.connection();
        ToolRequest toolRequest = decision.request();
        String tableName = toolRequest.text("table").orElse(null);

        return switch (decision.tool()) {
            case EXECUTE_QUERY -> {
                logger.warn("SECURITY: Executing read query with {} bound parameters, limit {}: {}",
                        decision.parameters().size(), decision.effectiveLimit(), abbreviate(decision.statement()));
                yield queryExecutor.execute(dbConn, decision.statement(), decision.parameters(), decision.effectiveLimit());
            }
            case GET_SCHEMA -> schemaInspector.getSchema(dbConn, tableName,
                    toolRequest.flag("include_columns", true), toolRequest.flag("include_indexes", false));
            case GET_TABLE_INFO -> {
                TableDetails tableDetails = schemaInspector.getTableInfo(dbConn, tableName, decision.effectiveLimit());
                if (tableDetails.rowCount() == null) {
                    markCountTimedOut(lease);
                }
                yield tableDetails;
            }
            case EXPLAIN_QUERY -> explainEngine.explain(dbConn, decision.statement(), decision.parameters());
            case GET_TABLE_STATS -> {
                List<TableStats> tableStats = statsEngine.getTableStats(dbConn, tableName);
                if (tableStats.stream().anyMatch(stats -> stats.rowCountSource() == RowCountSource.UNAVAILABLE)) {
                    markCountTimedOut(lease);
                }
                yield statsReport(tableStats);
            }
            case SEARCH_TABLES -> {
                String searchTerm = toolRequest.text("pattern").orElseThrow();
                SearchType searchType = SearchType.fromWire(toolRequest.text("search_type").orElse(null));
                yield searchReport(searchTerm, searchType, statsEngine.searchTables(dbConn, searchTerm, searchType));
            }
            case BACKUP_TABLE -> backupManager.backupTable(dbConn, tableName, toolRequest.text("backup_name").orElse(null));
            case INSERT_DATA -> insertHandler.insertRows(dbConn, InsertRequest.from(toolRequest));
            case CHECK_CONNECTION -> connectionManager.checkConnection();
        };
    }

    // a cancelled statement can leave the session in an unknown state
    private static void markCountTimedOut(PooledConnection lease) {
        logger.warn("Row count timed out, connection will be probed before it is reused");
        lease.markDegraded();
    }

    private static Map<String, Object> statsReport(List<TableStats> tableStats) {
        Map<String, Object> statsReport = new LinkedHashMap<>();
        statsReport.put("table_count", tableStats.size());
        statsReport.put("tables", tableStats);
        return statsReport;
    }

    private static Map<String, Object> searchReport(String searchTerm, SearchType searchType, List<SearchMatch> searchMatches) {
        Map<String, Object> searchReport = new LinkedHashMap<>();
        searchReport.put("pattern", searchTerm);
        searchReport.put("search_type", searchType.name().toLowerCase());
        searchReport.put("match_count", searchMatches.size());
        searchReport.put("matches", searchMatches);
        return searchReport;
    }

    private static String abbreviate(String sqlText) {
        return sqlText.length() > 100 ? sqlText.substring(0, 100) + "..." : sqlText;
    }
}

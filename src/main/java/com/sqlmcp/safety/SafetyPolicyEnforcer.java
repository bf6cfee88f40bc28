package com.sqlmcp.safety;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.tools.ToolName;
import com.sqlmcp.tools.ToolRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.sqlmcp.safety.SafetyRules.allowedArguments;
import static com.sqlmcp.safety.SafetyRules.boundParameters;
import static com.sqlmcp.safety.SafetyRules.optionalChoice;
import static com.sqlmcp.safety.SafetyRules.optionalFlag;
import static com.sqlmcp.safety.SafetyRules.optionalIdentifier;
import static com.sqlmcp.safety.SafetyRules.optionalIdentifierList;
import static com.sqlmcp.safety.SafetyRules.readStatement;
import static com.sqlmcp.safety.SafetyRules.requiredIdentifier;
import static com.sqlmcp.safety.SafetyRules.rowBatch;
import static com.sqlmcp.safety.SafetyRules.rowLimit;
import static com.sqlmcp.safety.SafetyRules.sampleRows;
import static com.sqlmcp.safety.SafetyRules.searchPattern;

/**
 * Single choke point between a tool request and the database. Each tool has exactly one entry in the
 * policy table; its rules run in order and the first violation rejects the request.
 */
public class SafetyPolicyEnforcer {
    private static final Logger logger = LoggerFactory.getLogger(SafetyPolicyEnforcer.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + SafetyPolicyEnforcer.class.getName());

    private final ConfigParams configParams;
    private final QueryGuard queryGuard;
    private final Map<ToolName, List<SafetyRule>> policyTable;

    public SafetyPolicyEnforcer(ConfigParams configParams) {
        this.configParams = configParams;
        this.queryGuard = new QueryGuard(configParams.getDatabaseType());
        this.policyTable = buildPolicyTable();

        for (ToolName toolName : ToolName.values()) {
            if (!policyTable.containsKey(toolName)) {
                throw new IllegalStateException("No safety policy registered for tool " + toolName);
            }
        }
    }

    private static Map<ToolName, List<SafetyRule>> buildPolicyTable() {
        Map<ToolName, List<SafetyRule>> rulesByTool = new EnumMap<>(ToolName.class);
        rulesByTool.put(ToolName.EXECUTE_QUERY, List.of(
                allowedArguments("query", "params", "limit"),
                readStatement("query"),
                boundParameters("params"),
                rowLimit("limit")));
        rulesByTool.put(ToolName.GET_SCHEMA, List.of(
                allowedArguments("table", "include_columns", "include_indexes"),
                optionalIdentifier("table"),
                optionalFlag("include_columns"),
                optionalFlag("include_indexes")));
        rulesByTool.put(ToolName.GET_TABLE_INFO, List.of(
                allowedArguments("table", "sample_rows"),
                requiredIdentifier("table"),
                sampleRows("sample_rows")));
        rulesByTool.put(ToolName.EXPLAIN_QUERY, List.of(
                allowedArguments("query", "params"),
                readStatement("query"),
                boundParameters("params")));
        rulesByTool.put(ToolName.CHECK_CONNECTION, List.of(
                allowedArguments()));
        rulesByTool.put(ToolName.GET_TABLE_STATS, List.of(
                allowedArguments("table"),
                optionalIdentifier("table")));
        rulesByTool.put(ToolName.SEARCH_TABLES, List.of(
                allowedArguments("pattern", "search_type"),
                searchPattern("pattern"),
                optionalChoice("search_type", "table", "column", "both")));
        rulesByTool.put(ToolName.BACKUP_TABLE, List.of(
                allowedArguments("table", "backup_name"),
                requiredIdentifier("table"),
                optionalIdentifier("backup_name")));
        rulesByTool.put(ToolName.INSERT_DATA, List.of(
                allowedArguments("table", "rows", "conflict_policy", "conflict_key"),
                requiredIdentifier("table"),
                optionalChoice("conflict_policy", "fail", "ignore", "update", "replace"),
                optionalIdentifierList("conflict_key"),
                rowBatch("rows")));
        return rulesByTool;
    }

    /**
     * Runs the request through its tool's rules.
     *
     * @param toolRequest The request to evaluate
     * @return An allow decision with the statement, parameters and limit to use, or a reject decision with the reason
     */
    public SafetyDecision evaluate(ToolRequest toolRequest) {
        PolicyContext policyContext = new PolicyContext(toolRequest, configParams, queryGuard);
        try {
            for (SafetyRule safetyRule : policyTable.get(toolRequest.tool())) {
                safetyRule.check(policyContext);
            }
        } catch (PolicyViolation violation) {
            securityLogger.warn("SECURITY_EVENT: REQUEST_REJECTED - tool={} kind={} reason={}",
                    toolRequest.tool(), violation.getErrorKind().wireCode(), violation.getMessage());
            return SafetyDecision.reject(toolRequest, violation.getErrorKind(), violation.getMessage());
        }

        SafetyDecision decision = policyContext.allow();
        logger.debug("Request allowed: tool={} limit={} parameters={}",
                toolRequest.tool(), decision.effectiveLimit(), decision.parameters().size());
        return decision;
    }
}

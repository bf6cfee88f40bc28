package com.sqlmcp.safety;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.tools.ToolRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable working state for one evaluation. Created per request and discarded once a decision is made.
 */
public class PolicyContext {
    private final ToolRequest request;
    private final ConfigParams configParams;
    private final QueryGuard queryGuard;
    private String statement;
    private List<Object> parameters = new ArrayList<>();
    private int effectiveLimit;

    PolicyContext(ToolRequest request, ConfigParams configParams, QueryGuard queryGuard) {
        this.request = request;
        this.configParams = configParams;
        this.queryGuard = queryGuard;
        this.effectiveLimit = configParams.defaultRowLimit();
    }

    public ToolRequest request() {
        return request;
    }

    public ConfigParams config() {
        return configParams;
    }

    public QueryGuard guard() {
        return queryGuard;
    }

    public String statement() {
        return statement;
    }

    public void setStatement(String statement) {
        this.statement = statement;
    }

    public List<Object> parameters() {
        return parameters;
    }

    public void setParameters(List<Object> parameters) {
        this.parameters = new ArrayList<>(parameters);
    }

    public int effectiveLimit() {
        return effectiveLimit;
    }

    public void setEffectiveLimit(int effectiveLimit) {
        this.effectiveLimit = effectiveLimit;
    }

    SafetyDecision allow() {
        return SafetyDecision.allow(request, statement, parameters, effectiveLimit);
    }
}

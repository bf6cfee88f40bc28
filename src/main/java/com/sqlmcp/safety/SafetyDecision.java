package com.sqlmcp.safety;

import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolName;
import com.sqlmcp.tools.ToolRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of evaluating one request against its tool's policy.
 *
 * @param request The request that was evaluated
 * @param allowed Whether the request may reach the database
 * @param rejectionKind Error kind when rejected, null when allowed
 * @param reason Human readable reason when rejected
 * @param statement The statement to execute, rewritten where the policy required it; null for tools without one
 * @param parameters Bound values in placeholder order; may contain nulls
 * @param effectiveLimit Row limit, sample size or batch size the policy settled on
 */
public record SafetyDecision(
        ToolRequest request,
        boolean allowed,
        ErrorKind rejectionKind,
        String reason,
        String statement,
        List<Object> parameters,
        int effectiveLimit
) {
    public SafetyDecision {
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        if (!allowed && (rejectionKind == null || reason == null)) {
            throw new IllegalArgumentException("A rejection needs a kind and a reason");
        }
        // parameters may legitimately hold SQL NULLs, so List.copyOf is not an option
        parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    static SafetyDecision allow(ToolRequest request, String statement, List<Object> parameters, int effectiveLimit) {
        return new SafetyDecision(request, true, null, null, statement, parameters, effectiveLimit);
    }

    static SafetyDecision reject(ToolRequest request, ErrorKind rejectionKind, String reason) {
        return new SafetyDecision(request, false, rejectionKind, reason, null, List.of(), 0);
    }

    public ToolName tool() {
        return request.tool();
    }
}

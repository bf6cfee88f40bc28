package com.sqlmcp.safety;

/**
 * One check in a tool's policy. Rules run in order and may rewrite the statement, parameters or limit
 * carried by the context.
 */
@FunctionalInterface
public interface SafetyRule {
    void check(PolicyContext policyContext) throws PolicyViolation;
}

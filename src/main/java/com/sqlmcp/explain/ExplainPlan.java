package com.sqlmcp.explain;

/**
 * The plan of one statement.
 *
 * @param statement The statement that was explained
 * @param dialect Database type whose plan format was read
 * @param root Top step of the plan tree
 */
public record ExplainPlan(String statement, String dialect, PlanStep root) {
}

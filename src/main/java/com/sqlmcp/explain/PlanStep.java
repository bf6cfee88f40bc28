package com.sqlmcp.explain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a normalized execution plan.
 *
 * @param operation Operation kind as the database names it, e.g. {@code Seq Scan} or {@code Index Seek}
 * @param estimatedCost Optimizer cost estimate in the database's own units, where reported
 * @param estimatedRows Estimated output rows, where reported
 * @param detail Target object, predicates or other dialect specific text
 * @param children Input steps, in plan order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanStep(String operation, Double estimatedCost, Double estimatedRows, String detail, List<PlanStep> children) {
    public PlanStep {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static PlanStep leaf(String operation, Double estimatedCost, Double estimatedRows, String detail) {
        return new PlanStep(operation, estimatedCost, estimatedRows, detail, List.of());
    }

    PlanStep withChildren(List<PlanStep> newChildren) {
        return new PlanStep(operation, estimatedCost, estimatedRows, detail, new ArrayList<>(newChildren));
    }
}

package com.sqlmcp.insert;

import java.util.List;

/**
 * Counts for a committed batch. Every row of the batch is counted exactly once.
 */
public record InsertOutcome(
        String table,
        ConflictPolicy conflictPolicy,
        int inserted,
        int updated,
        int skipped,
        List<String> conflictKey
) {
    public InsertOutcome {
        conflictKey = List.copyOf(conflictKey);
    }
}

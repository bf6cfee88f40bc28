package com.sqlmcp.tools;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of error kinds a tool call can end with. The wire code is what callers see.
 */
public enum ErrorKind {
    VALIDATION_REJECTED("ValidationRejected"),
    INVALID_ARGUMENTS("InvalidArguments"),
    UNKNOWN_TOOL("UnknownTool"),
    PERMISSION_DENIED("PermissionDenied"),
    NOT_FOUND("NotFound"),
    SOURCE_NOT_FOUND("SourceNotFound"),
    CONNECTION_UNAVAILABLE("ConnectionUnavailable"),
    POOL_EXHAUSTED("PoolExhausted"),
    TIMEOUT("Timeout"),
    SCHEMA_MISMATCH("SchemaMismatch"),
    CONFLICT_KEY_MISSING("ConflictKeyMissing"),
    ROW_CONFLICT("RowConflict"),
    BATCH_TOO_LARGE("BatchTooLarge"),
    TARGET_NAME_COLLISION_UNRESOLVED("TargetNameCollisionUnresolved"),
    COPY_FAILED("CopyFailed"),
    PLAN_UNAVAILABLE("PlanUnavailable"),
    DATABASE_ERROR("DatabaseError");

    private final String wireCode;

    ErrorKind(String wireCode) {
        this.wireCode = wireCode;
    }

    @JsonValue
    public String wireCode() {
        return wireCode;
    }

    /**
     * Whether a failure of this kind leaves the connection that produced it suspect.
     */
    public boolean isConnectionSuspect() {
        return this == TIMEOUT || this == CONNECTION_UNAVAILABLE;
    }
}

package com.sqlmcp.db;

import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Maps driver failures onto the gateway error taxonomy using SQLState classes and a few vendor codes.
 */
public final class SqlErrors {
    private static final Set<String> PERMISSION_STATES = Set.of("42501", "28000", "28P01");
    private static final Set<String> NOT_FOUND_STATES = Set.of("42S02", "42P01", "42102", "42103", "42104", "S0002");
    private static final Set<String> TIMEOUT_STATES = Set.of("HYT00", "HYT01", "57014");

    // SQL Server 229/230/262/300 and MySQL 1044/1045/1142/1143 are permission failures
    private static final Set<Integer> PERMISSION_VENDOR_CODES = Set.of(229, 230, 262, 300, 1044, 1045, 1142, 1143);
    // SQL Server 208 and MySQL 1146 are missing objects
    private static final Set<Integer> NOT_FOUND_VENDOR_CODES = Set.of(208, 1146);

    private SqlErrors() {
    }

    /**
     * Wraps a driver failure in a {@link ToolException} of the matching kind.
     *
     * @param e The driver failure
     * @param operation Short description of what was being done, used in the message
     */
    public static ToolException classify(SQLException e, String operation) {
        ErrorKind errorKind = kindOf(e);
        return new ToolException(errorKind,
                ResourceManager.getErrorMessage("sql.operation.failed", operation, describe(e)), e);
    }

    public static ErrorKind kindOf(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (isConnectionError(e)) {
            return ErrorKind.CONNECTION_UNAVAILABLE;
        }

        String sqlState = e.getSQLState();
        int vendorCode = e.getErrorCode();
        if (sqlState != null) {
            if (TIMEOUT_STATES.contains(sqlState)) {
                return ErrorKind.TIMEOUT;
            }
            if (PERMISSION_STATES.contains(sqlState)) {
                return ErrorKind.PERMISSION_DENIED;
            }
            if (NOT_FOUND_STATES.contains(sqlState)) {
                return ErrorKind.NOT_FOUND;
            }
            if (sqlState.startsWith("23")) {
                return ErrorKind.ROW_CONFLICT;
            }
        }
        if (PERMISSION_VENDOR_CODES.contains(vendorCode)) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (NOT_FOUND_VENDOR_CODES.contains(vendorCode)) {
            return ErrorKind.NOT_FOUND;
        }
        return ErrorKind.DATABASE_ERROR;
    }

    /**
     * Checks if the given SQLException indicates a connection-related problem.
     *
     * @param e The SQLException to examine
     * @return true if this appears to be a connection error
     */
    public static boolean isConnectionError(SQLException e) {
        if (e == null) {
            return false;
        }
        if (e instanceof SQLNonTransientConnectionException || e instanceof SQLTransientConnectionException) {
            return true;
        }
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    public static boolean isIntegrityViolation(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("23");
    }

    static String describe(SQLException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return e.getSQLState() == null ? message : message + " (SQLState " + e.getSQLState() + ")";
    }
}

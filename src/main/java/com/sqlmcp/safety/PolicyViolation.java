package com.sqlmcp.safety;

import com.sqlmcp.tools.ErrorKind;

/**
 * Raised by a {@link SafetyRule} to refuse a request. Never escapes the enforcer.
 */
public class PolicyViolation extends Exception {
    private final ErrorKind errorKind;

    public PolicyViolation(ErrorKind errorKind, String reason) {
        super(reason);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}

package com.sqlmcp.tools;

/**
 * Checked failure raised by a gateway component. Always carries the {@link ErrorKind} reported to the caller.
 */
public class ToolException extends Exception {
    private final ErrorKind errorKind;

    public ToolException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ToolException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}

package com.flagship.workforce_pay.exception;

/**
 * Base class for domain failures detected by the attendance ledger and the
 * payment request engine.
 */
public abstract class WorkforcePayException extends RuntimeException {

    private final ErrorKind kind;

    protected WorkforcePayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkforcePayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

package com.flagship.workforce_pay.exception;

/**
 * A uniqueness violation, or a write that lost an optimistic concurrency race.
 * Only the latter is {@code retryable}: re-reading the entity shows the winner's state.
 */
public class ConflictException extends WorkforcePayException {

    private final boolean retryable;

    public ConflictException(String message) {
        this(message, false, null);
    }

    public ConflictException(String message, boolean retryable, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
        this.retryable = retryable;
    }

    public static ConflictException concurrentModification(String entity, Object id, Throwable cause) {
        return new ConflictException(
            String.format("%s %s was modified concurrently. Reload and retry.", entity, id),
            true,
            cause);
    }

    public boolean isRetryable() {
        return retryable;
    }
}

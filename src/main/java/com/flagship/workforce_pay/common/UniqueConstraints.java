package com.flagship.workforce_pay.common;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * Tells a unique-index race apart from other integrity failures (foreign keys,
 * check constraints), which must keep propagating as they are.
 */
public final class UniqueConstraints {

    private UniqueConstraints() {
        // Utility class
    }

    public static boolean isViolationOf(DataIntegrityViolationException e, String constraintName) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause != null ? cause.getMessage() : e.getMessage();
        return message != null && message.contains(constraintName);
    }
}

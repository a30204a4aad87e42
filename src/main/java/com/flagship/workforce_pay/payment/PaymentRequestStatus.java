package com.flagship.workforce_pay.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.workforce_pay.exception.ValidationException;

import java.util.Arrays;

/**
 * Lifecycle of a payment request.
 *
 * PENDING moves to APPROVED or REJECTED; APPROVED moves to PROCESSED.
 * REJECTED and PROCESSED are terminal.
 */
public enum PaymentRequestStatus {
    /**
     * Submitted by the project owner, awaiting a decision.
     * The only state in which a request can be deleted.
     */
    PENDING("Pending"),

    /**
     * Approved and ready to be processed in a batch.
     */
    APPROVED("Approved"),

    /**
     * Terminal. Carries the rejection reason.
     */
    REJECTED("Rejected"),

    /**
     * Terminal. The amount has been disbursed.
     */
    PROCESSED("Processed");

    private final String label;

    PaymentRequestStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == PROCESSED;
    }

    /**
     * Accepts either the label or the constant name, ignoring case.
     */
    @JsonCreator
    public static PaymentRequestStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(status -> status.label.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown payment request status: " + value));
    }
}

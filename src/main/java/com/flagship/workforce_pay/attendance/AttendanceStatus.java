package com.flagship.workforce_pay.attendance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.workforce_pay.exception.ValidationException;

import java.util.Arrays;

/**
 * A worker's presence on one project for one day.
 * Stored by name, rendered by label ("Half Day").
 */
public enum AttendanceStatus {
    PRESENT("Present"),
    ABSENT("Absent"),
    LATE("Late"),
    HALF_DAY("Half Day");

    private final String label;

    AttendanceStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the label or the constant name, ignoring case.
     */
    @JsonCreator
    public static AttendanceStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(status -> status.label.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown attendance status: " + value));
    }
}

package com.flagship.workforce_pay.attendance;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

/**
 * Amendable attendance fields. A null field means "leave unchanged".
 */
@Value
@Builder
public class AttendanceChanges {
    LocalTime checkIn;
    LocalTime checkOut;
    AttendanceStatus status;
    Integer rating;
    String comments;

    public boolean isEmpty() {
        return checkIn == null && checkOut == null && status == null && rating == null && comments == null;
    }
}

package com.flagship.workforce_pay.attendance;

import lombok.Value;

/**
 * Result of a rating upsert: the record as stored and whether it was created by the call.
 */
@Value
public class RatingOutcome {
    AttendanceRecord record;
    boolean created;
}

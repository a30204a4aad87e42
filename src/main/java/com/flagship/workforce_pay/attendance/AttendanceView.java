package com.flagship.workforce_pay.attendance;

import lombok.Value;

/**
 * An attendance record with the display names a listing shows next to it.
 */
@Value
public class AttendanceView {
    AttendanceRecord record;
    String workerName;
    String projectName;
    String supervisorName;
}

package com.flagship.workforce_pay.attendance.dto;

import com.flagship.workforce_pay.attendance.AttendanceStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

@Value
public class RecordAttendanceRequest {

    @NotNull(message = "Worker ID is required")
    @Positive(message = "Worker ID must be positive")
    Long workerId;

    @NotNull(message = "Project ID is required")
    @Positive(message = "Project ID must be positive")
    Long projectId;

    @NotNull(message = "Date is required")
    LocalDate date;

    LocalTime checkIn;

    LocalTime checkOut;

    @NotNull(message = "Status is required")
    AttendanceStatus status;
}

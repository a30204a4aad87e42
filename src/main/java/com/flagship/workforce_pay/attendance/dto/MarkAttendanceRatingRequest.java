package com.flagship.workforce_pay.attendance.dto;

import com.flagship.workforce_pay.attendance.AttendanceStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;

/**
 * Supervisor rating for a worker's day. Creates the attendance record when
 * none exists for the (worker, project, date) tuple.
 */
@Value
public class MarkAttendanceRatingRequest {

    @NotNull(message = "Worker ID is required")
    @Positive(message = "Worker ID must be positive")
    Long workerId;

    @NotNull(message = "Project ID is required")
    @Positive(message = "Project ID must be positive")
    Long projectId;

    @NotNull(message = "Date is required")
    LocalDate date;

    @NotNull(message = "Status is required")
    AttendanceStatus status;

    @NotNull(message = "Rating is required")
    @Min(value = 1, message = "Rating must be between 1 and 5")
    @Max(value = 5, message = "Rating must be between 1 and 5")
    Integer rating;

    @Size(max = 1000, message = "Comments must be at most 1000 characters")
    String comments;
}

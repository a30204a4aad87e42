package com.flagship.workforce_pay.attendance.dto;

import com.flagship.workforce_pay.attendance.AttendanceChanges;
import com.flagship.workforce_pay.attendance.AttendanceStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalTime;

/**
 * The fields of an attendance record a caller may amend. Omitted fields stay
 * as they are; anything not listed here is ignored.
 */
@Value
public class UpdateAttendanceRequest {

    LocalTime checkIn;

    LocalTime checkOut;

    AttendanceStatus status;

    @Min(value = 1, message = "Rating must be between 1 and 5")
    @Max(value = 5, message = "Rating must be between 1 and 5")
    Integer rating;

    @Size(max = 1000, message = "Comments must be at most 1000 characters")
    String comments;

    public AttendanceChanges toChanges() {
        return AttendanceChanges.builder()
            .checkIn(checkIn)
            .checkOut(checkOut)
            .status(status)
            .rating(rating)
            .comments(comments)
            .build();
    }
}

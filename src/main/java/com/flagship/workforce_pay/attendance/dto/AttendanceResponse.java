package com.flagship.workforce_pay.attendance.dto;

import com.flagship.workforce_pay.attendance.AttendanceRecord;
import com.flagship.workforce_pay.attendance.AttendanceStatus;
import com.flagship.workforce_pay.attendance.AttendanceView;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Response DTO for attendance records. Display names are only present on
 * reads that join the directory.
 */
@Value
@Builder
public class AttendanceResponse {
    Long id;
    UUID publicId;
    Long userId;
    Long workerId;
    String workerName;
    Long projectId;
    String projectName;
    String supervisorName;
    LocalDate date;
    LocalTime checkIn;
    LocalTime checkOut;
    AttendanceStatus status;
    Integer rating;
    String comments;
    Instant createdAt;
    Instant updatedAt;

    public static AttendanceResponse from(AttendanceRecord record) {
        return base(record).build();
    }

    public static AttendanceResponse from(AttendanceView view) {
        return base(view.getRecord())
            .workerName(view.getWorkerName())
            .projectName(view.getProjectName())
            .supervisorName(view.getSupervisorName())
            .build();
    }

    private static AttendanceResponseBuilder base(AttendanceRecord record) {
        return AttendanceResponse.builder()
            .id(record.getId())
            .publicId(record.getPublicId())
            .userId(record.getOwnerId())
            .workerId(record.getWorkerId())
            .projectId(record.getProjectId())
            .date(record.getDate())
            .checkIn(record.getCheckIn())
            .checkOut(record.getCheckOut())
            .status(record.getStatus())
            .rating(record.getRating())
            .comments(record.getComments())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt());
    }
}

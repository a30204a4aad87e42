package com.flagship.workforce_pay.attendance;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * JPA entity for the attendance table.
 *
 * No setters: the tuple (worker, project, date) and the owning account never
 * change after insert, and the amendable fields only move through
 * {@link #updateFromDomain(AttendanceRecord)}.
 */
@Entity
@Table(
    name = "attendance",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_attendance_worker_project_date",
        columnNames = {"worker_id", "project_id", "date"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttendanceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "public_id", nullable = false, updatable = false, unique = true)
    private UUID publicId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private Long workerId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    @Column(name = "date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(name = "check_in")
    private LocalTime checkIn;

    @Column(name = "check_out")
    private LocalTime checkOut;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AttendanceStatus status;

    @Column
    private Integer rating;

    @Column(columnDefinition = "TEXT")
    private String comments;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AttendanceEntity fromDomain(AttendanceRecord record) {
        return new AttendanceEntity(
            null, // id - assigned by the identity column
            record.getPublicId(),
            record.getOwnerId(),
            record.getWorkerId(),
            record.getProjectId(),
            record.getDate(),
            record.getCheckIn(),
            record.getCheckOut(),
            record.getStatus(),
            record.getRating(),
            record.getComments(),
            null,
            null
        );
    }

    public AttendanceRecord toDomain() {
        return new AttendanceRecord(
            id,
            publicId,
            ownerId,
            workerId,
            projectId,
            date,
            checkIn,
            checkOut,
            status,
            rating,
            comments,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the amendable fields. Identity, tuple and ownership stay as inserted.
     */
    void updateFromDomain(AttendanceRecord record) {
        this.checkIn = record.getCheckIn();
        this.checkOut = record.getCheckOut();
        this.status = record.getStatus();
        this.rating = record.getRating();
        this.comments = record.getComments();
    }
}

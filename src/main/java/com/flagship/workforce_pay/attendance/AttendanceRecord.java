package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.exception.ValidationException;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * One attendance fact for the tuple (worker, project, date).
 *
 * Records are created once; afterwards only status, times, rating and comments
 * can be amended, and only by the owning account.
 */
@Value
@With
public class AttendanceRecord {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;
    public static final int MAX_COMMENTS_LENGTH = 1000;

    Long id;
    UUID publicId;
    Long ownerId;
    Long workerId;
    Long projectId;
    LocalDate date;
    LocalTime checkIn;
    LocalTime checkOut;
    AttendanceStatus status;
    Integer rating;
    String comments;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new, unsaved record from the check-in flow.
     */
    public static AttendanceRecord create(Long ownerId, Long workerId, Long projectId, LocalDate date,
                                          LocalTime checkIn, LocalTime checkOut, AttendanceStatus status) {
        if (ownerId == null || workerId == null || projectId == null) {
            throw new ValidationException("Owner, worker and project are required");
        }
        if (date == null) {
            throw new ValidationException("Attendance date is required");
        }
        if (status == null) {
            throw new ValidationException("Attendance status is required");
        }
        validateTimes(checkIn, checkOut);

        return new AttendanceRecord(
            null,
            UUID.randomUUID(),
            ownerId,
            workerId,
            projectId,
            date,
            checkIn,
            checkOut,
            status,
            null,
            null,
            null,
            null
        );
    }

    /**
     * Applies the non-null fields of {@code changes}; everything else is kept.
     */
    public AttendanceRecord amend(AttendanceChanges changes) {
        AttendanceRecord amended = this
            .withCheckIn(changes.getCheckIn() != null ? changes.getCheckIn() : checkIn)
            .withCheckOut(changes.getCheckOut() != null ? changes.getCheckOut() : checkOut)
            .withStatus(changes.getStatus() != null ? changes.getStatus() : status)
            .withRating(changes.getRating() != null ? changes.getRating() : rating)
            .withComments(changes.getComments() != null ? changes.getComments() : comments);

        validateTimes(amended.checkIn, amended.checkOut);
        if (changes.getRating() != null) {
            validateRating(changes.getRating());
        }
        validateComments(amended.comments);
        return amended;
    }

    public boolean isOwnedBy(Long accountId) {
        return ownerId != null && ownerId.equals(accountId);
    }

    public static void validateRating(Integer rating) {
        if (rating == null || rating < MIN_RATING || rating > MAX_RATING) {
            throw new ValidationException(
                String.format("Rating must be between %d and %d, got %s", MIN_RATING, MAX_RATING, rating));
        }
    }

    public static void validateComments(String comments) {
        if (comments != null && comments.length() > MAX_COMMENTS_LENGTH) {
            throw new ValidationException("Comments must be at most " + MAX_COMMENTS_LENGTH + " characters");
        }
    }

    private static void validateTimes(LocalTime checkIn, LocalTime checkOut) {
        if (checkIn != null && checkOut != null && checkOut.isBefore(checkIn)) {
            throw new ValidationException(
                String.format("Check-out %s is before check-in %s", checkOut, checkIn));
        }
    }
}

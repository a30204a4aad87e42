package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class AttendanceRecordTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    private AttendanceRecord checkedIn() {
        return AttendanceRecord.create(1L, 2L, 3L, DAY, LocalTime.of(8, 0), null, AttendanceStatus.PRESENT);
    }

    @Test
    @DisplayName("New record has no rating and a public id")
    void createDefaults() {
        AttendanceRecord record = checkedIn();

        assertNull(record.getId());
        assertNotNull(record.getPublicId());
        assertNull(record.getRating());
        assertTrue(record.isOwnedBy(1L));
        assertFalse(record.isOwnedBy(2L));
    }

    @Test
    @DisplayName("Date and status are required")
    void requiredFields() {
        assertThrows(ValidationException.class, () ->
            AttendanceRecord.create(1L, 2L, 3L, null, null, null, AttendanceStatus.PRESENT));
        assertThrows(ValidationException.class, () ->
            AttendanceRecord.create(1L, 2L, 3L, DAY, null, null, null));
    }

    @Test
    @DisplayName("Check-out before check-in is rejected")
    void checkOutBeforeCheckIn() {
        assertThrows(ValidationException.class, () ->
            AttendanceRecord.create(1L, 2L, 3L, DAY, LocalTime.of(9, 0), LocalTime.of(8, 0), AttendanceStatus.LATE));
    }

    @Test
    @DisplayName("Amend changes only the provided fields")
    void amendIsPartial() {
        AttendanceRecord amended = checkedIn().amend(AttendanceChanges.builder()
            .checkOut(LocalTime.of(17, 0))
            .rating(4)
            .build());

        assertEquals(LocalTime.of(8, 0), amended.getCheckIn());
        assertEquals(LocalTime.of(17, 0), amended.getCheckOut());
        assertEquals(AttendanceStatus.PRESENT, amended.getStatus());
        assertEquals(4, amended.getRating());
        assertNull(amended.getComments());
    }

    @Test
    @DisplayName("Amend validates rating and time order")
    void amendValidates() {
        AttendanceRecord record = checkedIn();

        assertThrows(ValidationException.class, () ->
            record.amend(AttendanceChanges.builder().rating(6).build()));
        assertThrows(ValidationException.class, () ->
            record.amend(AttendanceChanges.builder().rating(0).build()));
        assertThrows(ValidationException.class, () ->
            record.amend(AttendanceChanges.builder().checkOut(LocalTime.of(7, 30)).build()));
        assertThrows(ValidationException.class, () ->
            record.amend(AttendanceChanges.builder().comments("x".repeat(1001)).build()));
    }

    @Test
    @DisplayName("Rating bounds are inclusive")
    void ratingBounds() {
        assertDoesNotThrow(() -> AttendanceRecord.validateRating(1));
        assertDoesNotThrow(() -> AttendanceRecord.validateRating(5));
        assertThrows(ValidationException.class, () -> AttendanceRecord.validateRating(null));
    }

    @Test
    @DisplayName("Empty change set is detected")
    void emptyChanges() {
        assertTrue(AttendanceChanges.builder().build().isEmpty());
        assertFalse(AttendanceChanges.builder().comments("").build().isEmpty());
    }

    @Test
    @DisplayName("Status accepts labels and names")
    void statusParsing() {
        assertEquals(AttendanceStatus.HALF_DAY, AttendanceStatus.fromValue("Half Day"));
        assertEquals(AttendanceStatus.HALF_DAY, AttendanceStatus.fromValue("half_day"));
        assertEquals(AttendanceStatus.LATE, AttendanceStatus.fromValue("late"));
        assertThrows(ValidationException.class, () -> AttendanceStatus.fromValue("Sick"));
    }
}

package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.exception.InvalidStateException;
import com.flagship.workforce_pay.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment request state machine and total computation, without a database.
 */
class PaymentRequestTest {

    private static final Long OWNER = 1L;
    private static final Long APPROVER = 2L;

    private PaymentRequest pending() {
        return PaymentRequest.create(OWNER, "PR-1", 10L, LocalDate.of(2024, 3, 1),
            List.of(PaymentRequestLine.of(100L, 20, new BigDecimal("150.00"))), null);
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("Total is the sum of days x allowance over all lines")
        void totalIsSumOfLineTotals() {
            PaymentRequest request = PaymentRequest.create(OWNER, "PAY-1", 10L, LocalDate.of(2024, 3, 1),
                List.of(
                    PaymentRequestLine.of(100L, 20, new BigDecimal("150.00")),
                    PaymentRequestLine.of(101L, 18, new BigDecimal("120.00"))
                ),
                "March payroll");

            assertEquals(new BigDecimal("5160.00"), request.getTotalAmount());
            assertEquals(new BigDecimal("3000.00"), request.getLines().get(0).getLineTotal());
            assertEquals(new BigDecimal("2160.00"), request.getLines().get(1).getLineTotal());
            assertEquals(PaymentRequestStatus.PENDING, request.getStatus());
            assertNotNull(request.getPublicId());
            assertNull(request.getDecidedBy());
        }

        @Test
        @DisplayName("Allowance with more than two decimals is rejected, not rounded")
        void subCentAllowanceRejected() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                PaymentRequestLine.of(100L, 3, new BigDecimal("0.333")));
            assertTrue(e.getMessage().contains("two decimals"));

            assertThrows(ValidationException.class, () ->
                PaymentRequestLine.of(100L, 3, new BigDecimal("33.335")));
        }

        @Test
        @DisplayName("Trailing zeros beyond two decimals are accepted and the total stays exact")
        void trailingZerosAccepted() {
            PaymentRequestLine line = PaymentRequestLine.of(100L, 3, new BigDecimal("33.3300"));

            assertEquals(new BigDecimal("33.33"), line.getAllowancePerDay());
            assertEquals(new BigDecimal("99.99"), line.getLineTotal());

            PaymentRequest request = PaymentRequest.create(OWNER, "PR-EXACT", 10L, LocalDate.now(),
                List.of(line, PaymentRequestLine.of(101L, 7, new BigDecimal("0.01"))), null);
            assertEquals(new BigDecimal("100.06"), request.getTotalAmount());
        }

        @Test
        @DisplayName("Amounts too large for the stored columns are validation errors")
        void oversizedAmountsRejected() {
            assertThrows(ValidationException.class, () ->
                PaymentRequestLine.of(100L, 1, new BigDecimal("100000000.00")));
            assertThrows(ValidationException.class, () ->
                PaymentRequestLine.of(100L, Integer.MAX_VALUE, PaymentRequestLine.MAX_ALLOWANCE_PER_DAY));

            PaymentRequestLine largest = PaymentRequestLine.of(100L, 99_999, PaymentRequestLine.MAX_ALLOWANCE_PER_DAY);
            PaymentRequestLine second = PaymentRequestLine.of(101L, 99_999, PaymentRequestLine.MAX_ALLOWANCE_PER_DAY);
            PaymentRequestLine third = PaymentRequestLine.of(102L, 2, PaymentRequestLine.MAX_ALLOWANCE_PER_DAY);
            assertThrows(ValidationException.class, () ->
                PaymentRequest.create(OWNER, "PR-HUGE", 10L, LocalDate.now(), List.of(largest, second, third), null));
        }

        @Test
        @DisplayName("A request without lines is rejected")
        void emptyLinesRejected() {
            assertThrows(ValidationException.class, () ->
                PaymentRequest.create(OWNER, "PR-EMPTY", 10L, LocalDate.now(), List.of(), null));
        }

        @Test
        @DisplayName("The same worker may not appear twice")
        void duplicateWorkerRejected() {
            List<PaymentRequestLine> lines = List.of(
                PaymentRequestLine.of(100L, 5, new BigDecimal("10.00")),
                PaymentRequestLine.of(100L, 2, new BigDecimal("10.00")));

            ValidationException e = assertThrows(ValidationException.class, () ->
                PaymentRequest.create(OWNER, "PR-DUP", 10L, LocalDate.now(), lines, null));
            assertTrue(e.getMessage().contains("100"));
        }

        @Test
        @DisplayName("Non-positive days or allowance are rejected")
        void nonPositiveLineValuesRejected() {
            assertThrows(ValidationException.class, () -> PaymentRequestLine.of(100L, 0, new BigDecimal("10.00")));
            assertThrows(ValidationException.class, () -> PaymentRequestLine.of(100L, -1, new BigDecimal("10.00")));
            assertThrows(ValidationException.class, () -> PaymentRequestLine.of(100L, 1, BigDecimal.ZERO));
            assertThrows(ValidationException.class, () -> PaymentRequestLine.of(100L, 1, new BigDecimal("-5")));
        }

        @Test
        @DisplayName("Missing request date defaults to today")
        void requestDateDefaultsToToday() {
            PaymentRequest request = PaymentRequest.create(OWNER, "PR-TODAY", 10L, null,
                List.of(PaymentRequestLine.of(100L, 1, BigDecimal.TEN)), null);

            assertEquals(LocalDate.now(), request.getRequestDate());
        }

        @Test
        @DisplayName("Request id is required and bounded")
        void requestIdValidated() {
            List<PaymentRequestLine> lines = List.of(PaymentRequestLine.of(100L, 1, BigDecimal.TEN));

            assertThrows(ValidationException.class, () ->
                PaymentRequest.create(OWNER, " ", 10L, null, lines, null));
            assertThrows(ValidationException.class, () ->
                PaymentRequest.create(OWNER, "X".repeat(101), 10L, null, lines, null));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("PENDING -> APPROVED records the decision")
        void approve() {
            PaymentRequest approved = pending().approve(APPROVER);

            assertEquals(PaymentRequestStatus.APPROVED, approved.getStatus());
            assertEquals(APPROVER, approved.getDecidedBy());
            assertNotNull(approved.getDecidedAt());
            assertNull(approved.getRejectionReason());
        }

        @Test
        @DisplayName("PENDING -> REJECTED keeps the reason and the decider")
        void reject() {
            PaymentRequest rejected = pending().reject(APPROVER, "  Timesheet missing  ");

            assertEquals(PaymentRequestStatus.REJECTED, rejected.getStatus());
            assertEquals("Timesheet missing", rejected.getRejectionReason());
            assertEquals(APPROVER, rejected.getDecidedBy());
            assertTrue(rejected.isTerminal());
        }

        @Test
        @DisplayName("Rejecting without a reason is a validation error")
        void rejectRequiresReason() {
            assertThrows(ValidationException.class, () -> pending().reject(APPROVER, ""));
            assertThrows(ValidationException.class, () -> pending().reject(APPROVER, null));
        }

        @Test
        @DisplayName("APPROVED -> PROCESSED keeps the approval decision")
        void process() {
            PaymentRequest approved = pending().approve(APPROVER);
            PaymentRequest processed = approved.process();

            assertEquals(PaymentRequestStatus.PROCESSED, processed.getStatus());
            assertEquals(APPROVER, processed.getDecidedBy());
            assertEquals(approved.getDecidedAt(), processed.getDecidedAt());
            assertEquals(approved.getTotalAmount(), processed.getTotalAmount());
        }

        @Test
        @DisplayName("Approving twice is an invalid state")
        void doubleApprove() {
            PaymentRequest approved = pending().approve(APPROVER);

            assertThrows(InvalidStateException.class, () -> approved.approve(APPROVER));
        }

        @Test
        @DisplayName("Only approved requests can be processed")
        void processRequiresApproval() {
            assertThrows(InvalidStateException.class, () -> pending().process());
            assertThrows(InvalidStateException.class, () -> pending().reject(APPROVER, "no").process());
        }

        @Test
        @DisplayName("Terminal states allow no transition")
        void terminalStates() {
            PaymentRequest processed = pending().approve(APPROVER).process();
            PaymentRequest rejected = pending().reject(APPROVER, "no");

            for (PaymentRequestStatus target : PaymentRequestStatus.values()) {
                assertFalse(processed.canTransitionTo(target));
                assertFalse(rejected.canTransitionTo(target));
            }
            assertThrows(InvalidStateException.class, () -> rejected.approve(APPROVER));
            assertThrows(InvalidStateException.class, () -> processed.reject(APPROVER, "late"));
        }

        @Test
        @DisplayName("Only pending requests are deletable")
        void deletable() {
            assertTrue(pending().isDeletable());
            assertFalse(pending().approve(APPROVER).isDeletable());
        }
    }

    @Test
    @DisplayName("Status accepts label or name, case-insensitively")
    void statusParsing() {
        assertEquals(PaymentRequestStatus.APPROVED, PaymentRequestStatus.fromValue("approved"));
        assertEquals(PaymentRequestStatus.PROCESSED, PaymentRequestStatus.fromValue("PROCESSED"));
        assertEquals(PaymentRequestStatus.PENDING, PaymentRequestStatus.fromValue(" Pending "));
        assertThrows(ValidationException.class, () -> PaymentRequestStatus.fromValue("Paid"));
    }
}

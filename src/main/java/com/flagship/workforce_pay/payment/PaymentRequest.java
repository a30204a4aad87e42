package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.exception.InvalidStateException;
import com.flagship.workforce_pay.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Payment request domain object.
 *
 * Owns the status transitions: every transition returns a new instance and an
 * illegal one raises {@link InvalidStateException}. The total is fixed at
 * creation from the lines and never recomputed.
 */
@Value
public class PaymentRequest {
    public static final int MAX_REQUEST_ID_LENGTH = 100;
    /** Largest amount a {@code DECIMAL(15,2)} column holds. */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999999.99");

    Long id;
    UUID publicId;
    String requestId;
    Long ownerId;
    Long projectId;
    LocalDate requestDate;
    BigDecimal totalAmount;
    PaymentRequestStatus status;
    String notes;
    Long decidedBy;
    Instant decidedAt;
    String rejectionReason;
    Long version;
    List<PaymentRequestLine> lines;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING request.
     *
     * @throws ValidationException if there are no lines, a worker appears twice
     *         or the total does not fit the stored amount
     */
    public static PaymentRequest create(Long ownerId, String requestId, Long projectId, LocalDate requestDate,
                                        List<PaymentRequestLine> lines, String notes) {
        if (requestId == null || requestId.isBlank()) {
            throw new ValidationException("Request ID is required");
        }
        if (requestId.length() > MAX_REQUEST_ID_LENGTH) {
            throw new ValidationException("Request ID must be at most " + MAX_REQUEST_ID_LENGTH + " characters");
        }
        if (ownerId == null || projectId == null) {
            throw new ValidationException("Owner and project are required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("A payment request needs at least one worker line");
        }

        Set<Long> workers = new HashSet<>();
        for (PaymentRequestLine line : lines) {
            if (!workers.add(line.getWorkerId())) {
                throw new ValidationException("Worker " + line.getWorkerId() + " appears more than once");
            }
        }

        BigDecimal total = totalOf(lines);
        if (total.compareTo(MAX_AMOUNT) > 0) {
            throw new ValidationException("Payment request total exceeds " + MAX_AMOUNT);
        }

        return new PaymentRequest(
            null,
            UUID.randomUUID(),
            requestId.trim(),
            ownerId,
            projectId,
            requestDate != null ? requestDate : LocalDate.now(),
            total,
            PaymentRequestStatus.PENDING,
            notes,
            null,
            null,
            null,
            null,
            List.copyOf(lines),
            null,
            null
        );
    }

    /**
     * PENDING to APPROVED, recording who decided and when.
     */
    public PaymentRequest approve(Long actorId) {
        requireTransition(PaymentRequestStatus.APPROVED);
        return withDecision(PaymentRequestStatus.APPROVED, actorId, null);
    }

    /**
     * PENDING to REJECTED. The reason is required.
     */
    public PaymentRequest reject(Long actorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Rejection reason is required");
        }
        requireTransition(PaymentRequestStatus.REJECTED);
        return withDecision(PaymentRequestStatus.REJECTED, actorId, reason.trim());
    }

    /**
     * APPROVED to PROCESSED. The approval decision stays recorded.
     */
    public PaymentRequest process() {
        requireTransition(PaymentRequestStatus.PROCESSED);
        return new PaymentRequest(
            id, publicId, requestId, ownerId, projectId, requestDate, totalAmount,
            PaymentRequestStatus.PROCESSED,
            notes, decidedBy, decidedAt, rejectionReason, version, lines, createdAt, Instant.now()
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isOwnedBy(Long accountId) {
        return ownerId != null && ownerId.equals(accountId);
    }

    public boolean isDeletable() {
        return status == PaymentRequestStatus.PENDING;
    }

    public boolean canTransitionTo(PaymentRequestStatus target) {
        return switch (status) {
            case PENDING -> target == PaymentRequestStatus.APPROVED || target == PaymentRequestStatus.REJECTED;
            case APPROVED -> target == PaymentRequestStatus.PROCESSED;
            case REJECTED, PROCESSED -> false;
        };
    }

    /**
     * Sum of the line totals. Line totals carry two decimals, so the sum is exact.
     */
    public static BigDecimal totalOf(List<PaymentRequestLine> lines) {
        return lines.stream()
            .map(PaymentRequestLine::getLineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.UNNECESSARY);
    }

    private void requireTransition(PaymentRequestStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                "Cannot move payment request %s from %s to %s", requestId, status.getLabel(), target.getLabel()));
        }
    }

    private PaymentRequest withDecision(PaymentRequestStatus target, Long actorId, String reason) {
        Instant now = Instant.now();
        return new PaymentRequest(
            id, publicId, requestId, ownerId, projectId, requestDate, totalAmount,
            target,
            notes, actorId, now, reason, version, lines, createdAt, now
        );
    }
}

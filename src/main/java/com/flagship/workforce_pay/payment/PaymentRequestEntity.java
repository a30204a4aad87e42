package com.flagship.workforce_pay.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for payment_requests.
 *
 * No setters: the request identity, owner, project, total and lines are fixed at
 * insert. Status and decision fields only change through
 * {@link #updateFromDomain(PaymentRequest)}. {@code version} guards every update
 * against a concurrent writer.
 */
@Entity
@Table(
    name = "payment_requests",
    indexes = {
        @Index(name = "idx_payment_requests_status", columnList = "status"),
        @Index(name = "idx_payment_requests_user_id", columnList = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "public_id", nullable = false, updatable = false, unique = true)
    private UUID publicId;

    @Column(name = "request_id", nullable = false, updatable = false, unique = true, length = 100)
    private String requestId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    @Column(name = "request_date", nullable = false, updatable = false)
    private LocalDate requestDate;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentRequestStatus status;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "decided_by")
    private Long decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Version
    @Column(nullable = false)
    private Long version;

    @OneToMany(mappedBy = "paymentRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<PaymentRequestLineEntity> lines = new ArrayList<>();

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

    static PaymentRequestEntity fromDomain(PaymentRequest request) {
        PaymentRequestEntity entity = new PaymentRequestEntity();
        entity.publicId = request.getPublicId();
        entity.requestId = request.getRequestId();
        entity.ownerId = request.getOwnerId();
        entity.projectId = request.getProjectId();
        entity.requestDate = request.getRequestDate();
        entity.totalAmount = request.getTotalAmount();
        entity.status = request.getStatus();
        entity.notes = request.getNotes();
        entity.decidedBy = request.getDecidedBy();
        entity.decidedAt = request.getDecidedAt();
        entity.rejectionReason = request.getRejectionReason();
        // id, version and timestamps are assigned on insert
        for (PaymentRequestLine line : request.getLines()) {
            entity.lines.add(PaymentRequestLineEntity.fromDomain(line, entity));
        }
        return entity;
    }

    public PaymentRequest toDomain() {
        return new PaymentRequest(
            id,
            publicId,
            requestId,
            ownerId,
            projectId,
            requestDate,
            totalAmount,
            status,
            notes,
            decidedBy,
            decidedAt,
            rejectionReason,
            version,
            lines.stream().map(PaymentRequestLineEntity::toDomain).toList(),
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the status and decision fields. Everything else stays as inserted.
     */
    void updateFromDomain(PaymentRequest request) {
        this.status = request.getStatus();
        this.decidedBy = request.getDecidedBy();
        this.decidedAt = request.getDecidedAt();
        this.rejectionReason = request.getRejectionReason();
    }
}

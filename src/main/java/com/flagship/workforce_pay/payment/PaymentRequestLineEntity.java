package com.flagship.workforce_pay.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for payment_request_lines. Inserted with its request, never updated.
 */
@Entity
@Table(name = "payment_request_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentRequestLineEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "payment_request_id", nullable = false, updatable = false)
    private PaymentRequestEntity paymentRequest;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private Long workerId;

    @Column(name = "days_worked", nullable = false, updatable = false)
    private int daysWorked;

    @Column(name = "allowance_per_day", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal allowancePerDay;

    @Column(name = "line_total", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal lineTotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PaymentRequestLineEntity fromDomain(PaymentRequestLine line, PaymentRequestEntity paymentRequest) {
        PaymentRequestLineEntity entity = new PaymentRequestLineEntity();
        entity.paymentRequest = paymentRequest;
        entity.workerId = line.getWorkerId();
        entity.daysWorked = line.getDaysWorked();
        entity.allowancePerDay = line.getAllowancePerDay();
        entity.lineTotal = line.getLineTotal();
        return entity;
    }

    public PaymentRequestLine toDomain() {
        return new PaymentRequestLine(id, workerId, daysWorked, allowancePerDay, lineTotal, createdAt);
    }
}

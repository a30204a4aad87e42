package com.flagship.workforce_pay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Business metrics for the attendance ledger and the payment request engine.
 *
 * Metrics exposed:
 * - attendance.recorded{status}: attendance records created through check-in
 * - attendance.rated{outcome}: rating upserts, created or updated
 * - payment_requests.created: payment requests created
 * - payment_requests.transition{to}: approvals, rejections and processing
 * - payment_requests.processed.amount: amounts disbursed by batch processing
 * - workforce.operation.latency{operation}: service operation latency
 * - workforce.conflicts{kind}: uniqueness and optimistic-lock conflicts
 */
@Component
public class WorkforceMetrics {

    private final MeterRegistry registry;

    private final Counter paymentRequestsCreated;
    private final DistributionSummary processedAmount;

    public WorkforceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.paymentRequestsCreated = Counter.builder("payment_requests.created")
                .description("Number of payment requests created")
                .register(registry);

        this.processedAmount = DistributionSummary.builder("payment_requests.processed.amount")
                .description("Total amount of processed payment requests per batch")
                .baseUnit("currency")
                .register(registry);
    }

    public void recordAttendance(String status) {
        registry.counter("attendance.recorded", "status", sanitizeTag(status)).increment();
    }

    public void recordRating(boolean created) {
        registry.counter("attendance.rated", "outcome", created ? "created" : "updated").increment();
    }

    public void incrementPaymentRequestsCreated() {
        paymentRequestsCreated.increment();
    }

    public void recordTransition(String toStatus) {
        registry.counter("payment_requests.transition", "to", sanitizeTag(toStatus)).increment();
    }

    public void recordProcessedAmount(BigDecimal amount) {
        if (amount != null) {
            processedAmount.record(amount.doubleValue());
        }
    }

    public void recordConflict(String kind) {
        registry.counter("workforce.conflicts", "kind", sanitizeTag(kind)).increment();
    }

    /**
     * Uses registry.timer() for meter lookup/creation per operation tag.
     */
    public void recordLatency(String operation, long durationMs) {
        registry.timer("workforce.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

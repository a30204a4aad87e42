package com.flagship.workforce_pay.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class WorkforceMetricsTest {

    private SimpleMeterRegistry registry;
    private WorkforceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WorkforceMetrics(registry);
    }

    @Test
    void countersAreTaggedAndSanitized() {
        metrics.recordAttendance("HALF_DAY");
        metrics.recordAttendance("HALF_DAY");
        metrics.recordTransition("APPROVED");
        metrics.recordConflict("request id/taken");
        metrics.recordRating(false);

        assertEquals(2.0, registry.get("attendance.recorded").tag("status", "HALF_DAY").counter().count());
        assertEquals(1.0, registry.get("payment_requests.transition").tag("to", "APPROVED").counter().count());
        assertEquals(1.0, registry.get("workforce.conflicts").tag("kind", "request_id_taken").counter().count());
        assertEquals(1.0, registry.get("attendance.rated").tag("outcome", "updated").counter().count());
    }

    @Test
    void amountsAndLatency() {
        metrics.incrementPaymentRequestsCreated();
        metrics.recordProcessedAmount(new BigDecimal("5160.00"));
        metrics.recordProcessedAmount(null);
        metrics.recordLatency("payment_request.create", 12);

        assertEquals(1.0, registry.get("payment_requests.created").counter().count());
        assertEquals(1, registry.get("payment_requests.processed.amount").summary().count());
        assertEquals(5160.0, registry.get("payment_requests.processed.amount").summary().totalAmount());
        assertEquals(1, registry.get("workforce.operation.latency")
            .tag("operation", "payment_request_create").timer().count());
    }
}

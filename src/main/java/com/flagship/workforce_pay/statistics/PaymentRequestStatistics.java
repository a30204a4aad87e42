package com.flagship.workforce_pay.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Payment request counts per status, plus the amount approved so far.
 * Processed requests stay part of the approved amount.
 */
@Value
public class PaymentRequestStatistics {
    long totalRequests;
    long pendingRequests;
    long approvedRequests;
    long rejectedRequests;
    long processedRequests;
    BigDecimal totalApprovedAmount;

    public static PaymentRequestStatistics of(long total, long pending, long approved, long rejected,
                                              long processed, BigDecimal approvedAmount) {
        BigDecimal amount = approvedAmount == null ? BigDecimal.ZERO : approvedAmount;
        return new PaymentRequestStatistics(
            total, pending, approved, rejected, processed, amount.setScale(2, RoundingMode.HALF_UP));
    }
}

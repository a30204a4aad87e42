package com.flagship.workforce_pay.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Outcome of a successful batch: every request in it is now PROCESSED.
 */
@Value
public class ProcessedBatch {
    List<PaymentRequest> processed;
    int processedCount;
    BigDecimal totalAmount;

    public static ProcessedBatch of(List<PaymentRequest> processed) {
        BigDecimal total = processed.stream()
            .map(PaymentRequest::getTotalAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
        return new ProcessedBatch(List.copyOf(processed), processed.size(), total);
    }
}

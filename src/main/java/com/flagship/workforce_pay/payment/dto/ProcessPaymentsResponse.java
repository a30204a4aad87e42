package com.flagship.workforce_pay.payment.dto;

import com.flagship.workforce_pay.payment.ProcessedBatch;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ProcessPaymentsResponse {
    int processedCount;
    BigDecimal totalAmount;
    List<PaymentRequestResponse> processed;

    public static ProcessPaymentsResponse from(ProcessedBatch batch) {
        return new ProcessPaymentsResponse(
            batch.getProcessedCount(),
            batch.getTotalAmount(),
            batch.getProcessed().stream().map(request -> PaymentRequestResponse.from(request)).toList()
        );
    }
}

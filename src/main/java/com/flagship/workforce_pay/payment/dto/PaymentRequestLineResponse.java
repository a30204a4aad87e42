package com.flagship.workforce_pay.payment.dto;

import com.flagship.workforce_pay.payment.PaymentRequestLine;
import com.flagship.workforce_pay.payment.PaymentRequestLineView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PaymentRequestLineResponse {
    Long workerId;
    String workerName;
    String position;
    int daysWorked;
    BigDecimal allowancePerDay;
    BigDecimal lineTotal;

    public static PaymentRequestLineResponse from(PaymentRequestLine line) {
        return base(line).build();
    }

    public static PaymentRequestLineResponse from(PaymentRequestLineView view) {
        return base(view.getLine())
            .workerName(view.getWorkerName())
            .position(view.getPosition())
            .build();
    }

    private static PaymentRequestLineResponseBuilder base(PaymentRequestLine line) {
        return PaymentRequestLineResponse.builder()
            .workerId(line.getWorkerId())
            .daysWorked(line.getDaysWorked())
            .allowancePerDay(line.getAllowancePerDay())
            .lineTotal(line.getLineTotal());
    }
}

package com.flagship.workforce_pay.payment.dto;

import com.flagship.workforce_pay.payment.PaymentRequestLine;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PaymentLineRequest {

    @NotNull(message = "Worker ID is required")
    @Positive(message = "Worker ID must be positive")
    Long workerId;

    @NotNull(message = "Days worked is required")
    @Positive(message = "Days worked must be positive")
    Integer daysWorked;

    @NotNull(message = "Allowance per day is required")
    @DecimalMin(value = "0.01", message = "Allowance per day must be greater than 0")
    @Digits(integer = 8, fraction = 2, message = "Allowance per day allows at most two decimals")
    BigDecimal allowancePerDay;

    public PaymentRequestLine toLine() {
        return PaymentRequestLine.of(workerId, daysWorked, allowancePerDay);
    }
}

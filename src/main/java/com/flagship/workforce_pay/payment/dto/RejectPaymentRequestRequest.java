package com.flagship.workforce_pay.payment.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class RejectPaymentRequestRequest {

    @NotBlank(message = "Rejection reason is required")
    String reason;
}

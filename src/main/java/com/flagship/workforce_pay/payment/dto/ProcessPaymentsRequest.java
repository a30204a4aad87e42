package com.flagship.workforce_pay.payment.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class ProcessPaymentsRequest {

    @NotEmpty(message = "At least one payment request ID is required")
    List<String> requestIds;
}

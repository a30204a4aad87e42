package com.flagship.workforce_pay.payment.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for submitting a payment request. {@code requestDate} defaults
 * to today when omitted.
 */
@Value
public class CreatePaymentRequestRequest {

    @NotBlank(message = "Request ID is required")
    @Size(max = 100, message = "Request ID must be at most 100 characters")
    String requestId;

    @NotNull(message = "Project ID is required")
    @Positive(message = "Project ID must be positive")
    Long projectId;

    LocalDate requestDate;

    @NotEmpty(message = "At least one worker line is required")
    List<@Valid PaymentLineRequest> workers;

    String notes;
}

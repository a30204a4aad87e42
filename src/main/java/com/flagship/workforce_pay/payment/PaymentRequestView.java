package com.flagship.workforce_pay.payment;

import lombok.Value;

/**
 * A payment request with the display names listings show next to it.
 * {@code decidedByName} is null until someone approves or rejects it.
 */
@Value
public class PaymentRequestView {
    PaymentRequest request;
    String projectName;
    String requesterName;
    String decidedByName;
}

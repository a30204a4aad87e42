package com.flagship.workforce_pay.payment;

import lombok.Value;

import java.util.List;

@Value
public class PaymentRequestDetails {
    PaymentRequestView view;
    List<PaymentRequestLineView> lines;
}

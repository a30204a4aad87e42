package com.flagship.workforce_pay.payment;

import lombok.Value;

@Value
public class PaymentRequestLineView {
    PaymentRequestLine line;
    String workerName;
    String position;
}

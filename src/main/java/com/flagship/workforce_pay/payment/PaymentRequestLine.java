package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * One worker's share of a payment request. Immutable once the request exists.
 */
@Value
public class PaymentRequestLine {
    /** Largest allowance a {@code DECIMAL(10,2)} column holds. */
    public static final BigDecimal MAX_ALLOWANCE_PER_DAY = new BigDecimal("99999999.99");

    Long id;
    Long workerId;
    int daysWorked;
    BigDecimal allowancePerDay;
    BigDecimal lineTotal;
    Instant createdAt;

    /**
     * Creates an unsaved line; {@code lineTotal = daysWorked * allowancePerDay}, exact.
     *
     * @throws ValidationException if a value is missing, not positive, has more than
     *         two decimals or does not fit the stored amounts
     */
    public static PaymentRequestLine of(Long workerId, Integer daysWorked, BigDecimal allowancePerDay) {
        if (workerId == null) {
            throw new ValidationException("Worker ID is required on every line");
        }
        if (daysWorked == null || daysWorked <= 0) {
            throw new ValidationException("Days worked must be positive for worker " + workerId);
        }
        if (allowancePerDay == null || allowancePerDay.signum() <= 0) {
            throw new ValidationException("Allowance per day must be positive for worker " + workerId);
        }
        if (allowancePerDay.stripTrailingZeros().scale() > 2) {
            throw new ValidationException("Allowance per day allows at most two decimals for worker " + workerId);
        }
        if (allowancePerDay.compareTo(MAX_ALLOWANCE_PER_DAY) > 0) {
            throw new ValidationException("Allowance per day must not exceed " + MAX_ALLOWANCE_PER_DAY
                + " for worker " + workerId);
        }

        BigDecimal allowance = allowancePerDay.setScale(2, RoundingMode.UNNECESSARY);
        BigDecimal total = allowance.multiply(BigDecimal.valueOf(daysWorked));
        if (total.compareTo(PaymentRequest.MAX_AMOUNT) > 0) {
            throw new ValidationException("Line total for worker " + workerId + " exceeds " + PaymentRequest.MAX_AMOUNT);
        }
        return new PaymentRequestLine(null, workerId, daysWorked, allowance, total, null);
    }
}

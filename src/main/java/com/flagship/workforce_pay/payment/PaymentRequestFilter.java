package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.common.DateRange;
import com.flagship.workforce_pay.common.SqlConditions;
import lombok.Builder;
import lombok.Value;

/**
 * Filter set shared by payment request listings and payment statistics.
 * The date range applies to {@code request_date}.
 */
@Value
@Builder(toBuilder = true)
public class PaymentRequestFilter {
    Long userId;
    Long projectId;
    PaymentRequestStatus status;
    @Builder.Default
    DateRange dateRange = DateRange.unbounded();

    /**
     * @param alias table alias including the trailing dot ("pr."), or empty
     */
    public SqlConditions toConditions(String alias) {
        SqlConditions conditions = new SqlConditions()
            .addIfPresent(alias + "user_id = ?", userId)
            .addIfPresent(alias + "project_id = ?", projectId)
            .addIfPresent(alias + "status = ?", status != null ? status.name() : null);
        DateRange range = dateRange != null ? dateRange : DateRange.unbounded();
        return range.applyTo(conditions, alias + "request_date");
    }
}

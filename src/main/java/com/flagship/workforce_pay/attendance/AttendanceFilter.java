package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.common.DateRange;
import com.flagship.workforce_pay.common.SqlConditions;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filter set shared by attendance listings and attendance statistics.
 * {@code userId} is the ownership scope and is always set by the caller's identity.
 */
@Value
@Builder(toBuilder = true)
public class AttendanceFilter {
    Long userId;
    Long workerId;
    Long projectId;
    AttendanceStatus status;
    LocalDate date;
    @Builder.Default
    DateRange dateRange = DateRange.unbounded();

    /**
     * @param alias table alias including the trailing dot ("a."), or empty
     */
    public SqlConditions toConditions(String alias) {
        SqlConditions conditions = new SqlConditions()
            .addIfPresent(alias + "user_id = ?", userId)
            .addIfPresent(alias + "worker_id = ?", workerId)
            .addIfPresent(alias + "project_id = ?", projectId)
            .addIfPresent(alias + "status = ?", status != null ? status.name() : null)
            .addIfPresent(alias + "date = ?", date);
        DateRange range = dateRange != null ? dateRange : DateRange.unbounded();
        return range.applyTo(conditions, alias + "date");
    }
}

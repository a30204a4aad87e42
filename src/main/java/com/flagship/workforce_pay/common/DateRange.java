package com.flagship.workforce_pay.common;

import com.flagship.workforce_pay.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive calendar date range; either bound may be open.
 */
@Value
public class DateRange {
    LocalDate startDate;
    LocalDate endDate;

    public static DateRange of(LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ValidationException(
                String.format("startDate %s is after endDate %s", startDate, endDate));
        }
        return new DateRange(startDate, endDate);
    }

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    /**
     * Adds the bounds of this range as predicates on the given date column.
     */
    public SqlConditions applyTo(SqlConditions conditions, String column) {
        return conditions
            .addIfPresent(column + " >= ?", startDate)
            .addIfPresent(column + " <= ?", endDate);
    }
}

package com.flagship.workforce_pay.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Attendance counts for a filter set.
 *
 * {@code attendanceRate} counts late arrivals as attended: (present + late) / total,
 * as a percentage with two decimals.
 */
@Value
public class AttendanceStatistics {
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    long totalRecords;
    long presentCount;
    long absentCount;
    long lateCount;
    long halfDayCount;
    BigDecimal attendanceRate;
    BigDecimal averageRating;

    /**
     * @param averageRating mean of the non-null ratings, or null when nothing was rated
     */
    public static AttendanceStatistics of(long totalRecords, long presentCount, long absentCount,
                                          long lateCount, long halfDayCount, BigDecimal averageRating) {
        BigDecimal rate = totalRecords == 0
            ? ZERO
            : BigDecimal.valueOf(presentCount + lateCount)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalRecords), 2, RoundingMode.HALF_UP);

        BigDecimal rating = averageRating == null
            ? ZERO
            : averageRating.setScale(2, RoundingMode.HALF_UP);

        return new AttendanceStatistics(
            totalRecords, presentCount, absentCount, lateCount, halfDayCount, rate, rating);
    }

    public static AttendanceStatistics empty() {
        return of(0, 0, 0, 0, 0, null);
    }
}

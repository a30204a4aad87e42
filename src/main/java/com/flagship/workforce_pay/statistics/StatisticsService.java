package com.flagship.workforce_pay.statistics;

import com.flagship.workforce_pay.attendance.AttendanceFilter;
import com.flagship.workforce_pay.common.SqlConditions;
import com.flagship.workforce_pay.payment.PaymentRequestFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-side aggregates over attendance and payment requests.
 *
 * Each aggregate is one statement whose WHERE clause comes from the same filter
 * object the listings use, so counts here match the listing totals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatisticsService {

    private static final String ATTENDANCE_AGGREGATE =
        "SELECT COUNT(*) AS total, " +
        "       COUNT(*) FILTER (WHERE status = 'PRESENT') AS present, " +
        "       COUNT(*) FILTER (WHERE status = 'ABSENT') AS absent, " +
        "       COUNT(*) FILTER (WHERE status = 'LATE') AS late, " +
        "       COUNT(*) FILTER (WHERE status = 'HALF_DAY') AS half_day, " +
        "       AVG(rating) AS average_rating " +
        "FROM attendance";

    private static final String PAYMENT_REQUEST_AGGREGATE =
        "SELECT COUNT(*) AS total, " +
        "       COUNT(*) FILTER (WHERE status = 'PENDING') AS pending, " +
        "       COUNT(*) FILTER (WHERE status = 'APPROVED') AS approved, " +
        "       COUNT(*) FILTER (WHERE status = 'REJECTED') AS rejected, " +
        "       COUNT(*) FILTER (WHERE status = 'PROCESSED') AS processed, " +
        "       COALESCE(SUM(total_amount) FILTER (WHERE status IN ('APPROVED', 'PROCESSED')), 0) AS approved_amount " +
        "FROM payment_requests";

    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public AttendanceStatistics attendanceStatistics(AttendanceFilter filter) {
        SqlConditions conditions = filter.toConditions("");

        AttendanceStatistics statistics = jdbcTemplate.queryForObject(
            ATTENDANCE_AGGREGATE + conditions.toWhereClause(),
            (rs, rowNum) -> AttendanceStatistics.of(
                rs.getLong("total"),
                rs.getLong("present"),
                rs.getLong("absent"),
                rs.getLong("late"),
                rs.getLong("half_day"),
                rs.getBigDecimal("average_rating")
            ),
            conditions.params()
        );

        log.debug("Attendance statistics for user {}: {}", filter.getUserId(), statistics);
        return statistics != null ? statistics : AttendanceStatistics.empty();
    }

    @Transactional(readOnly = true)
    public PaymentRequestStatistics paymentStatistics(PaymentRequestFilter filter) {
        SqlConditions conditions = filter.toConditions("");

        PaymentRequestStatistics statistics = jdbcTemplate.queryForObject(
            PAYMENT_REQUEST_AGGREGATE + conditions.toWhereClause(),
            (rs, rowNum) -> PaymentRequestStatistics.of(
                rs.getLong("total"),
                rs.getLong("pending"),
                rs.getLong("approved"),
                rs.getLong("rejected"),
                rs.getLong("processed"),
                rs.getBigDecimal("approved_amount")
            ),
            conditions.params()
        );

        log.debug("Payment request statistics for user {}: {}", filter.getUserId(), statistics);
        return statistics != null ? statistics : PaymentRequestStatistics.of(0, 0, 0, 0, 0, null);
    }
}

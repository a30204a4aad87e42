package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.common.PagedResult;
import com.flagship.workforce_pay.common.Pagination;
import com.flagship.workforce_pay.common.SqlConditions;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Enriched reads over payment requests and their lines.
 *
 * Listings carry no lines; {@link #findLines(Long)} loads them for the detail view.
 */
@Repository
public class PaymentRequestQueryRepository {

    private static final String SELECT_ENRICHED =
        "SELECT pr.id, pr.public_id, pr.request_id, pr.user_id, pr.project_id, pr.request_date, " +
        "       pr.total_amount, pr.status, pr.notes, pr.decided_by, pr.decided_at, pr.rejection_reason, " +
        "       pr.version, pr.created_at, pr.updated_at, " +
        "       p.name AS project_name, requester.name AS requester_name, decider.name AS decided_by_name " +
        "FROM payment_requests pr " +
        "JOIN projects p ON pr.project_id = p.id " +
        "JOIN users requester ON pr.user_id = requester.id " +
        "LEFT JOIN users decider ON pr.decided_by = decider.id";

    private final JdbcTemplate jdbcTemplate;

    public PaymentRequestQueryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<PaymentRequestView> findView(String requestId) {
        return jdbcTemplate.query(
            SELECT_ENRICHED + " WHERE pr.request_id = ?",
            viewRowMapper(),
            requestId
        ).stream().findFirst();
    }

    /**
     * Newest first. The count runs over the same conditions as the page.
     */
    public PagedResult<PaymentRequestView> findPage(PaymentRequestFilter filter, Pagination pagination) {
        SqlConditions conditions = filter.toConditions("pr.");

        List<PaymentRequestView> rows = jdbcTemplate.query(
            SELECT_ENRICHED + conditions.toWhereClause() +
                " ORDER BY pr.created_at DESC, pr.id DESC LIMIT ? OFFSET ?",
            viewRowMapper(),
            conditions.paramsWith(pagination.getLimit(), pagination.getOffset())
        );

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM payment_requests pr" + conditions.toWhereClause(),
            Long.class,
            conditions.params()
        );

        return PagedResult.of(rows, pagination, total != null ? total : 0L);
    }

    public List<PaymentRequestLineView> findLines(Long paymentRequestId) {
        return jdbcTemplate.query(
            "SELECT l.id, l.worker_id, l.days_worked, l.allowance_per_day, l.line_total, l.created_at, " +
            "       w.fullname AS worker_name, w.position " +
            "FROM payment_request_lines l " +
            "JOIN workers w ON l.worker_id = w.id " +
            "WHERE l.payment_request_id = ? " +
            "ORDER BY l.id",
            (rs, rowNum) -> new PaymentRequestLineView(
                new PaymentRequestLine(
                    rs.getLong("id"),
                    rs.getLong("worker_id"),
                    rs.getInt("days_worked"),
                    rs.getBigDecimal("allowance_per_day"),
                    rs.getBigDecimal("line_total"),
                    toInstant(rs, "created_at")
                ),
                rs.getString("worker_name"),
                rs.getString("position")
            ),
            paymentRequestId
        );
    }

    private RowMapper<PaymentRequestView> viewRowMapper() {
        return (rs, rowNum) -> new PaymentRequestView(
            new PaymentRequest(
                rs.getLong("id"),
                rs.getObject("public_id", UUID.class),
                rs.getString("request_id"),
                rs.getLong("user_id"),
                rs.getLong("project_id"),
                rs.getObject("request_date", LocalDate.class),
                rs.getBigDecimal("total_amount"),
                PaymentRequestStatus.valueOf(rs.getString("status")),
                rs.getString("notes"),
                (Long) rs.getObject("decided_by"),
                toInstant(rs, "decided_at"),
                rs.getString("rejection_reason"),
                rs.getLong("version"),
                List.of(),
                toInstant(rs, "created_at"),
                toInstant(rs, "updated_at")
            ),
            rs.getString("project_name"),
            rs.getString("requester_name"),
            rs.getString("decided_by_name")
        );
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}

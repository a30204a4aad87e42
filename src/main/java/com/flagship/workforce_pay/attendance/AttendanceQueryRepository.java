package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.common.PagedResult;
import com.flagship.workforce_pay.common.Pagination;
import com.flagship.workforce_pay.common.SqlConditions;
import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Attendance statements that JPA does not express well: the rating upsert and
 * the enriched, filtered listing.
 */
@Repository
public class AttendanceQueryRepository {

    private static final String SELECT_ENRICHED =
        "SELECT a.id, a.public_id, a.user_id, a.worker_id, a.project_id, a.date, a.check_in, a.check_out, " +
        "       a.status, a.rating, a.comments, a.created_at, a.updated_at, " +
        "       w.fullname AS worker_name, p.name AS project_name, u.name AS supervisor_name " +
        "FROM attendance a " +
        "JOIN workers w ON a.worker_id = w.id " +
        "JOIN projects p ON a.project_id = p.id " +
        "JOIN users u ON a.user_id = u.id";

    private final JdbcTemplate jdbcTemplate;

    public AttendanceQueryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the record, or replaces status, rating and comments of the existing
     * record for the same (worker, project, date). Check-in and check-out of an
     * existing record are left as they are.
     *
     * A single statement, so two concurrent ratings of the same tuple converge on
     * one row holding whichever rating committed last.
     */
    public UpsertOutcome upsertRating(Long ownerId, Long workerId, Long projectId, LocalDate date,
                                      AttendanceStatus status, int rating, String comments) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO attendance (public_id, user_id, worker_id, project_id, date, status, rating, comments) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT ON CONSTRAINT uq_attendance_worker_project_date DO UPDATE SET " +
            "    status = EXCLUDED.status, " +
            "    rating = EXCLUDED.rating, " +
            "    comments = EXCLUDED.comments, " +
            "    updated_at = CURRENT_TIMESTAMP " +
            "RETURNING id, (xmax = 0) AS inserted",
            (rs, rowNum) -> new UpsertOutcome(rs.getLong("id"), rs.getBoolean("inserted")),
            UUID.randomUUID(),
            ownerId,
            workerId,
            projectId,
            date,
            status.name(),
            rating,
            comments
        );
    }

    public Optional<AttendanceView> findView(Long attendanceId) {
        return jdbcTemplate.query(
            SELECT_ENRICHED + " WHERE a.id = ?",
            attendanceViewRowMapper(),
            attendanceId
        ).stream().findFirst();
    }

    public PagedResult<AttendanceView> findPage(AttendanceFilter filter, Pagination pagination) {
        SqlConditions conditions = filter.toConditions("a.");

        List<AttendanceView> rows = jdbcTemplate.query(
            SELECT_ENRICHED + conditions.toWhereClause() +
                " ORDER BY a.date DESC, a.created_at DESC, a.id DESC LIMIT ? OFFSET ?",
            attendanceViewRowMapper(),
            conditions.paramsWith(pagination.getLimit(), pagination.getOffset())
        );

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM attendance a" + conditions.toWhereClause(),
            Long.class,
            conditions.params()
        );

        return PagedResult.of(rows, pagination, total != null ? total : 0L);
    }

    private RowMapper<AttendanceView> attendanceViewRowMapper() {
        return (rs, rowNum) -> new AttendanceView(
            new AttendanceRecord(
                rs.getLong("id"),
                rs.getObject("public_id", UUID.class),
                rs.getLong("user_id"),
                rs.getLong("worker_id"),
                rs.getLong("project_id"),
                rs.getObject("date", LocalDate.class),
                rs.getObject("check_in", LocalTime.class),
                rs.getObject("check_out", LocalTime.class),
                AttendanceStatus.valueOf(rs.getString("status")),
                (Integer) rs.getObject("rating"),
                rs.getString("comments"),
                toInstant(rs, "created_at"),
                toInstant(rs, "updated_at")
            ),
            rs.getString("worker_name"),
            rs.getString("project_name"),
            rs.getString("supervisor_name")
        );
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    /**
     * Result of {@link #upsertRating}: the row id and whether it was newly inserted.
     */
    @Value
    public static class UpsertOutcome {
        long id;
        boolean created;
    }
}

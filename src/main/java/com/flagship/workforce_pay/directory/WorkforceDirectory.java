package com.flagship.workforce_pay.directory;

import com.flagship.workforce_pay.exception.NotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Existence and ownership lookups for workers and projects.
 *
 * Worker and project lifecycles belong to the registration side of the platform;
 * this service only reads them, with plain JDBC.
 */
@Service
public class WorkforceDirectory {

    private final JdbcTemplate jdbcTemplate;

    public WorkforceDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Worker> findWorker(Long workerId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, fullname, position, salary FROM workers WHERE id = ?",
            workerRowMapper(),
            workerId
        ).stream().findFirst();
    }

    public Optional<Project> findProject(Long projectId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, name, category, start_date, end_date, status FROM projects WHERE id = ?",
            projectRowMapper(),
            projectId
        ).stream().findFirst();
    }

    public Optional<String> findUserName(Long userId) {
        return jdbcTemplate.queryForList("SELECT name FROM users WHERE id = ?", String.class, userId)
            .stream()
            .findFirst();
    }

    /**
     * A worker that exists but belongs to another account is reported as missing,
     * so callers cannot probe for other accounts' workers.
     */
    public Worker requireOwnedWorker(Long workerId, Long ownerId) {
        return findWorker(workerId)
            .filter(worker -> worker.isOwnedBy(ownerId))
            .orElseThrow(() -> new NotFoundException(
                "Worker not found or access denied: " + workerId));
    }

    public Project requireOwnedProject(Long projectId, Long ownerId) {
        return findProject(projectId)
            .filter(project -> project.isOwnedBy(ownerId))
            .orElseThrow(() -> new NotFoundException(
                "Project not found or access denied: " + projectId));
    }

    private RowMapper<Worker> workerRowMapper() {
        return (rs, rowNum) -> new Worker(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getString("fullname"),
            rs.getString("position"),
            rs.getBigDecimal("salary")
        );
    }

    private RowMapper<Project> projectRowMapper() {
        return (rs, rowNum) -> new Project(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getString("name"),
            rs.getString("category"),
            rs.getObject("start_date", java.time.LocalDate.class),
            rs.getObject("end_date", java.time.LocalDate.class),
            rs.getString("status")
        );
    }
}

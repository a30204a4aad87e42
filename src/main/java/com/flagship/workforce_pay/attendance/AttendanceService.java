package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.common.DateRange;
import com.flagship.workforce_pay.common.PagedResult;
import com.flagship.workforce_pay.common.Pagination;
import com.flagship.workforce_pay.common.UniqueConstraints;
import com.flagship.workforce_pay.directory.Worker;
import com.flagship.workforce_pay.directory.WorkforceDirectory;
import com.flagship.workforce_pay.exception.ConflictException;
import com.flagship.workforce_pay.exception.ForbiddenException;
import com.flagship.workforce_pay.exception.NotFoundException;
import com.flagship.workforce_pay.exception.ValidationException;
import com.flagship.workforce_pay.observability.CorrelationContext;
import com.flagship.workforce_pay.observability.WorkforceMetrics;
import com.flagship.workforce_pay.statistics.AttendanceStatistics;
import com.flagship.workforce_pay.statistics.StatisticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Attendance ledger: one record per (worker, project, date), owned by the
 * account that recorded it.
 *
 * Worker and project ownership is checked against the directory before any
 * write. Reads and amendments are scoped to the owning account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceService {

    static final String UNIQUE_TUPLE_CONSTRAINT = "uq_attendance_worker_project_date";
    static final int SUMMARY_RECENT_LIMIT = 100;

    private final AttendanceRepository attendanceRepository;
    private final AttendanceQueryRepository queryRepository;
    private final WorkforceDirectory directory;
    private final StatisticsService statisticsService;
    private final WorkforceMetrics metrics;

    /**
     * Records a check-in.
     *
     * @throws NotFoundException if the worker or project is missing or owned by someone else
     * @throws ConflictException if the worker already has a record for this project and date
     */
    @Transactional
    public AttendanceRecord record(Long userId, Long workerId, Long projectId, LocalDate date,
                                   LocalTime checkIn, LocalTime checkOut, AttendanceStatus status) {
        long startTime = System.currentTimeMillis();

        directory.requireOwnedWorker(workerId, userId);
        directory.requireOwnedProject(projectId, userId);

        AttendanceRecord record = AttendanceRecord.create(
            userId, workerId, projectId, date, checkIn, checkOut, status);

        if (attendanceRepository.existsByWorkerIdAndProjectIdAndDate(workerId, projectId, date)) {
            metrics.recordConflict("attendance_duplicate");
            throw duplicate(workerId, projectId, date, null);
        }

        AttendanceEntity saved;
        try {
            saved = attendanceRepository.saveAndFlush(AttendanceEntity.fromDomain(record));
        } catch (DataIntegrityViolationException e) {
            if (!UniqueConstraints.isViolationOf(e, UNIQUE_TUPLE_CONSTRAINT)) {
                throw e;
            }
            // Lost the race against a concurrent insert of the same tuple
            metrics.recordConflict("attendance_duplicate");
            throw duplicate(workerId, projectId, date, e);
        }

        AttendanceRecord stored = saved.toDomain();
        metrics.recordAttendance(stored.getStatus().name());
        metrics.recordLatency("attendance.record", System.currentTimeMillis() - startTime);
        log.info("Attendance recorded: id={}, worker={}, project={}, date={}, status={}",
            stored.getId(), workerId, projectId, date, stored.getStatus());
        return stored;
    }

    /**
     * Rates a worker for a day, creating the record if none exists yet.
     * An existing record keeps its check-in and check-out times.
     */
    @Transactional
    public RatingOutcome markWithRating(Long userId, Long workerId, Long projectId, LocalDate date,
                                        AttendanceStatus status, Integer rating, String comments) {
        long startTime = System.currentTimeMillis();

        if (date == null) {
            throw new ValidationException("Attendance date is required");
        }
        if (status == null) {
            throw new ValidationException("Attendance status is required");
        }
        AttendanceRecord.validateRating(rating);
        AttendanceRecord.validateComments(comments);

        directory.requireOwnedWorker(workerId, userId);
        directory.requireOwnedProject(projectId, userId);

        AttendanceQueryRepository.UpsertOutcome outcome = queryRepository.upsertRating(
            userId, workerId, projectId, date, status, rating, comments);

        AttendanceRecord stored = attendanceRepository.findById(outcome.getId())
            .map(AttendanceEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException(
                "Attendance row " + outcome.getId() + " vanished after upsert"));

        metrics.recordRating(outcome.isCreated());
        metrics.recordLatency("attendance.mark_rating", System.currentTimeMillis() - startTime);
        log.info("Attendance rated: id={}, worker={}, date={}, rating={}, created={}",
            stored.getId(), workerId, date, rating, outcome.isCreated());
        return new RatingOutcome(stored, outcome.isCreated());
    }

    /**
     * Applies the given changes to a record owned by the caller.
     *
     * @throws NotFoundException if no such record exists
     * @throws ForbiddenException if the record belongs to another account
     */
    @Transactional
    public AttendanceRecord update(Long attendanceId, AttendanceChanges changes, Long callerId) {
        if (changes == null || changes.isEmpty()) {
            throw new ValidationException("No valid fields to update");
        }

        MDC.put(CorrelationContext.ATTENDANCE_ID_MDC_KEY, String.valueOf(attendanceId));
        try {
            AttendanceEntity entity = requireOwnedEntity(attendanceId, callerId);
            AttendanceRecord amended = entity.toDomain().amend(changes);

            entity.updateFromDomain(amended);
            AttendanceRecord updated = attendanceRepository.saveAndFlush(entity).toDomain();

            log.info("Attendance updated: id={}, status={}, rating={}",
                attendanceId, updated.getStatus(), updated.getRating());
            return updated;
        } finally {
            MDC.remove(CorrelationContext.ATTENDANCE_ID_MDC_KEY);
        }
    }

    /**
     * Hard-deletes a record owned by the caller.
     */
    @Transactional
    public void delete(Long attendanceId, Long callerId) {
        MDC.put(CorrelationContext.ATTENDANCE_ID_MDC_KEY, String.valueOf(attendanceId));
        try {
            AttendanceEntity entity = requireOwnedEntity(attendanceId, callerId);
            attendanceRepository.delete(entity);
            log.info("Attendance deleted: id={}", attendanceId);
        } finally {
            MDC.remove(CorrelationContext.ATTENDANCE_ID_MDC_KEY);
        }
    }

    /**
     * Records of other accounts are reported as missing.
     */
    @Transactional(readOnly = true)
    public AttendanceView get(Long attendanceId, Long callerId) {
        return queryRepository.findView(attendanceId)
            .filter(view -> view.getRecord().isOwnedBy(callerId))
            .orElseThrow(() -> NotFoundException.of("Attendance record", attendanceId));
    }

    @Transactional(readOnly = true)
    public PagedResult<AttendanceView> query(AttendanceFilter filter, Pagination pagination) {
        if (filter.getUserId() == null) {
            throw new ValidationException("Attendance queries are always scoped to a user");
        }
        return queryRepository.findPage(filter, pagination);
    }

    /**
     * The worker's directory entry, statistics for the given range and up to
     * {@value #SUMMARY_RECENT_LIMIT} most recent records.
     */
    @Transactional(readOnly = true)
    public WorkerAttendanceSummary workerSummary(Long userId, Long workerId, Long projectId, DateRange dateRange) {
        Worker worker = directory.requireOwnedWorker(workerId, userId);

        AttendanceFilter filter = AttendanceFilter.builder()
            .userId(userId)
            .workerId(workerId)
            .projectId(projectId)
            .dateRange(dateRange != null ? dateRange : DateRange.unbounded())
            .build();

        AttendanceStatistics statistics = statisticsService.attendanceStatistics(filter);
        List<AttendanceView> recent = queryRepository
            .findPage(filter, Pagination.firstPage(SUMMARY_RECENT_LIMIT))
            .getItems();

        return new WorkerAttendanceSummary(worker, statistics, recent);
    }

    private AttendanceEntity requireOwnedEntity(Long attendanceId, Long callerId) {
        AttendanceEntity entity = attendanceRepository.findById(attendanceId)
            .orElseThrow(() -> NotFoundException.of("Attendance record", attendanceId));

        if (!entity.toDomain().isOwnedBy(callerId)) {
            log.warn("User {} attempted to modify attendance {} owned by {}",
                callerId, attendanceId, entity.getOwnerId());
            throw new ForbiddenException("You can only modify your own attendance records");
        }
        return entity;
    }

    private static ConflictException duplicate(Long workerId, Long projectId, LocalDate date, Throwable cause) {
        return new ConflictException(
            String.format("Attendance already recorded for worker %d on project %d for %s",
                workerId, projectId, date),
            false,
            cause);
    }
}

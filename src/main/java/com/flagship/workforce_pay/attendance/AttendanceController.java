package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.attendance.dto.AttendanceResponse;
import com.flagship.workforce_pay.attendance.dto.MarkAttendanceRatingRequest;
import com.flagship.workforce_pay.attendance.dto.RecordAttendanceRequest;
import com.flagship.workforce_pay.attendance.dto.UpdateAttendanceRequest;
import com.flagship.workforce_pay.attendance.dto.WorkerAttendanceSummaryResponse;
import com.flagship.workforce_pay.common.DateRange;
import com.flagship.workforce_pay.common.PagedResult;
import com.flagship.workforce_pay.common.Pagination;
import com.flagship.workforce_pay.identity.CallerIdentity;
import com.flagship.workforce_pay.statistics.AttendanceStatistics;
import com.flagship.workforce_pay.statistics.StatisticsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST endpoints of the attendance ledger. Every call is scoped to the caller
 * resolved from the identity headers.
 */
@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
@Slf4j
public class AttendanceController {

    private final AttendanceService attendanceService;
    private final StatisticsService statisticsService;

    @PostMapping
    public ResponseEntity<AttendanceResponse> record(
            CallerIdentity caller,
            @Valid @RequestBody RecordAttendanceRequest request) {

        log.info("Recording attendance: worker={}, project={}, date={}",
            request.getWorkerId(), request.getProjectId(), request.getDate());

        AttendanceRecord record = attendanceService.record(
            caller.getId(),
            request.getWorkerId(),
            request.getProjectId(),
            request.getDate(),
            request.getCheckIn(),
            request.getCheckOut(),
            request.getStatus()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AttendanceResponse.from(record));
    }

    /**
     * 201 when the call created the record, 200 when it re-rated an existing one.
     */
    @PostMapping("/mark-rating")
    public ResponseEntity<AttendanceResponse> markWithRating(
            CallerIdentity caller,
            @Valid @RequestBody MarkAttendanceRatingRequest request) {

        RatingOutcome outcome = attendanceService.markWithRating(
            caller.getId(),
            request.getWorkerId(),
            request.getProjectId(),
            request.getDate(),
            request.getStatus(),
            request.getRating(),
            request.getComments()
        );
        return ResponseEntity.status(outcome.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
            .body(AttendanceResponse.from(outcome.getRecord()));
    }

    @GetMapping
    public ResponseEntity<PagedResult<AttendanceResponse>> query(
            CallerIdentity caller,
            @RequestParam(required = false) Long workerId,
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) AttendanceStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        AttendanceFilter filter = AttendanceFilter.builder()
            .userId(caller.getId())
            .workerId(workerId)
            .projectId(projectId)
            .status(status)
            .date(date)
            .dateRange(DateRange.of(startDate, endDate))
            .build();

        PagedResult<AttendanceView> result = attendanceService.query(filter, Pagination.of(page, limit));
        return ResponseEntity.ok(result.map(view -> AttendanceResponse.from(view)));
    }

    @GetMapping("/stats")
    public ResponseEntity<AttendanceStatistics> statistics(
            CallerIdentity caller,
            @RequestParam(required = false) Long workerId,
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        AttendanceFilter filter = AttendanceFilter.builder()
            .userId(caller.getId())
            .workerId(workerId)
            .projectId(projectId)
            .dateRange(DateRange.of(startDate, endDate))
            .build();

        return ResponseEntity.ok(statisticsService.attendanceStatistics(filter));
    }

    @GetMapping("/{attendanceId}")
    public ResponseEntity<AttendanceResponse> get(
            CallerIdentity caller,
            @PathVariable("attendanceId") Long attendanceId) {
        return ResponseEntity.ok(AttendanceResponse.from(attendanceService.get(attendanceId, caller.getId())));
    }

    @PutMapping("/{attendanceId}")
    public ResponseEntity<AttendanceResponse> update(
            CallerIdentity caller,
            @PathVariable("attendanceId") Long attendanceId,
            @Valid @RequestBody UpdateAttendanceRequest request) {

        AttendanceRecord updated = attendanceService.update(attendanceId, request.toChanges(), caller.getId());
        return ResponseEntity.ok(AttendanceResponse.from(updated));
    }

    @DeleteMapping("/{attendanceId}")
    public ResponseEntity<Void> delete(
            CallerIdentity caller,
            @PathVariable("attendanceId") Long attendanceId) {
        attendanceService.delete(attendanceId, caller.getId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/worker/{workerId}/summary")
    public ResponseEntity<WorkerAttendanceSummaryResponse> workerSummary(
            CallerIdentity caller,
            @PathVariable("workerId") Long workerId,
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        WorkerAttendanceSummary summary = attendanceService.workerSummary(
            caller.getId(), workerId, projectId, DateRange.of(startDate, endDate));
        return ResponseEntity.ok(WorkerAttendanceSummaryResponse.from(summary));
    }
}

package com.flagship.workforce_pay.attendance.dto;

import com.flagship.workforce_pay.attendance.WorkerAttendanceSummary;
import com.flagship.workforce_pay.directory.Worker;
import com.flagship.workforce_pay.statistics.AttendanceStatistics;
import lombok.Value;

import java.util.List;

@Value
public class WorkerAttendanceSummaryResponse {
    WorkerInfo worker;
    AttendanceStatistics statistics;
    List<AttendanceResponse> recentAttendance;

    public static WorkerAttendanceSummaryResponse from(WorkerAttendanceSummary summary) {
        Worker worker = summary.getWorker();
        return new WorkerAttendanceSummaryResponse(
            new WorkerInfo(worker.getId(), worker.getFullname(), worker.getPosition()),
            summary.getStatistics(),
            summary.getRecentRecords().stream().map(view -> AttendanceResponse.from(view)).toList()
        );
    }

    @Value
    public static class WorkerInfo {
        Long id;
        String fullname;
        String position;
    }
}

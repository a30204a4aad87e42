package com.flagship.workforce_pay.attendance;

import com.flagship.workforce_pay.directory.Worker;
import com.flagship.workforce_pay.statistics.AttendanceStatistics;
import lombok.Value;

import java.util.List;

@Value
public class WorkerAttendanceSummary {
    Worker worker;
    AttendanceStatistics statistics;
    List<AttendanceView> recentRecords;
}

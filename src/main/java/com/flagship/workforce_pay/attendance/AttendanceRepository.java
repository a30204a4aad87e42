package com.flagship.workforce_pay.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;

@Repository
public interface AttendanceRepository extends JpaRepository<AttendanceEntity, Long> {

    boolean existsByWorkerIdAndProjectIdAndDate(Long workerId, Long projectId, LocalDate date);
}

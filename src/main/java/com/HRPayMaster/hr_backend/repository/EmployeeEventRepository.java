package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.EventStatus;
import com.HRPayMaster.hr_backend.model.EmployeeEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface EmployeeEventRepository extends JpaRepository<EmployeeEvent, UUID> {

    /**
     * Events that can project into {@code [startDate, endDate]}: one-off events dated inside it,
     * and monthly events that started on or before its end and have not ended before its start.
     */
    @Query("SELECT e FROM EmployeeEvent e WHERE e.employee.id = :employeeId " +
            "AND e.status = :status AND (" +
            "(e.recurrenceType = com.HRPayMaster.hr_backend.enums.RecurrenceType.NONE AND e.eventDate >= :startDate AND e.eventDate <= :endDate) OR " +
            "(e.recurrenceType = com.HRPayMaster.hr_backend.enums.RecurrenceType.MONTHLY AND e.eventDate <= :endDate " +
            "AND (e.recurrenceEndDate IS NULL OR e.recurrenceEndDate >= :startDate)))")
    List<EmployeeEvent> findCandidatesForPeriod(@Param("employeeId") UUID employeeId,
                                                @Param("status") EventStatus status,
                                                @Param("startDate") LocalDate startDate,
                                                @Param("endDate") LocalDate endDate);

    List<EmployeeEvent> findByEmployeeIdOrderByEventDateDesc(UUID employeeId);
}

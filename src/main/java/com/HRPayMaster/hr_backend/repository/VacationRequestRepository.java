package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface VacationRequestRepository extends JpaRepository<VacationRequest, UUID> {

    @Query("SELECT v FROM VacationRequest v WHERE v.employee.id = :employeeId " +
            "AND v.status IN :statuses AND v.startDate <= :endDate AND v.endDate >= :startDate " +
            "ORDER BY v.startDate ASC")
    List<VacationRequest> findOverlapping(@Param("employeeId") UUID employeeId,
                                          @Param("statuses") Collection<VacationStatus> statuses,
                                          @Param("startDate") LocalDate startDate,
                                          @Param("endDate") LocalDate endDate);

    @Query("SELECT v FROM VacationRequest v JOIN FETCH v.employee e LEFT JOIN FETCH e.department " +
            "WHERE v.status IN :statuses AND v.startDate <= :endDate AND v.endDate >= :startDate")
    List<VacationRequest> findAllOverlapping(@Param("statuses") Collection<VacationStatus> statuses,
                                             @Param("startDate") LocalDate startDate,
                                             @Param("endDate") LocalDate endDate);

    @Query("SELECT v FROM VacationRequest v WHERE " +
            "(:employeeId IS NULL OR v.employee.id = :employeeId) AND " +
            "(:status IS NULL OR v.status = :status)")
    Page<VacationRequest> findByCriteria(@Param("employeeId") UUID employeeId,
                                         @Param("status") VacationStatus status,
                                         Pageable pageable);

    @Query("SELECT v FROM VacationRequest v JOIN FETCH v.employee e WHERE v.status = com.HRPayMaster.hr_backend.enums.VacationStatus.APPROVED " +
            "AND e.status = com.HRPayMaster.hr_backend.enums.EmployeeStatus.ON_LEAVE AND v.endDate >= :from AND v.endDate <= :to")
    List<VacationRequest> findApprovedEndingBetweenForEmployeesOnLeave(@Param("from") LocalDate from,
                                                                        @Param("to") LocalDate to);
}

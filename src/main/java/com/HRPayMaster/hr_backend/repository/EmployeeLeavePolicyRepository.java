package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.model.EmployeeLeavePolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EmployeeLeavePolicyRepository extends JpaRepository<EmployeeLeavePolicy, UUID> {

    @Query("SELECT a FROM EmployeeLeavePolicy a JOIN FETCH a.policy p " +
            "WHERE a.employee.id = :employeeId AND LOWER(p.leaveType) = LOWER(:leaveType) " +
            "ORDER BY a.effectiveFrom ASC")
    List<EmployeeLeavePolicy> findAssignments(@Param("employeeId") UUID employeeId,
                                              @Param("leaveType") String leaveType);

    List<EmployeeLeavePolicy> findByEmployeeId(UUID employeeId);
}

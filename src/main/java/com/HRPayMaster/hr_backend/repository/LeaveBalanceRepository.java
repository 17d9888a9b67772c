package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.model.LeaveBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LeaveBalanceRepository extends JpaRepository<LeaveBalance, UUID> {
    Optional<LeaveBalance> findByEmployeeIdAndLeaveTypeIgnoreCaseAndYear(UUID employeeId, String leaveType, int year);
}

package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.model.LeaveAccrualPolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LeaveAccrualPolicyRepository extends JpaRepository<LeaveAccrualPolicy, UUID> {
    List<LeaveAccrualPolicy> findByLeaveTypeIgnoreCase(String leaveType);
}

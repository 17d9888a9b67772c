package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.LedgerEntryType;
import com.HRPayMaster.hr_backend.model.LeaveAccrualLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface LeaveAccrualLedgerRepository extends JpaRepository<LeaveAccrualLedgerEntry, UUID> {

    boolean existsByEmployeeIdAndLeaveTypeAndEntryTypeAndEntryDateAndSourceKey(UUID employeeId,
                                                                               String leaveType,
                                                                               LedgerEntryType entryType,
                                                                               LocalDate entryDate,
                                                                               String sourceKey);

    List<LeaveAccrualLedgerEntry> findByEmployeeIdOrderByEntryDateAscCreatedAtAsc(UUID employeeId);
}

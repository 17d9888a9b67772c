package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.model.PayrollRunDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PayrollRunDayRepository extends JpaRepository<PayrollRunDay, UUID> {

    @Modifying
    @Query("DELETE FROM PayrollRunDay d WHERE d.payrollRunId = :payrollRunId")
    int deleteByPayrollRunId(@Param("payrollRunId") UUID payrollRunId);
}

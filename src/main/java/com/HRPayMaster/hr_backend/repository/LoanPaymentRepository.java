package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.model.LoanPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LoanPaymentRepository extends JpaRepository<LoanPayment, UUID> {
    List<LoanPayment> findByLoanIdOrderByPaymentDateAsc(UUID loanId);

    @Modifying
    @Query("UPDATE LoanPayment p SET p.payrollRun = null WHERE p.payrollRun.id = :payrollRunId")
    int detachFromPayrollRun(@Param("payrollRunId") UUID payrollRunId);
}

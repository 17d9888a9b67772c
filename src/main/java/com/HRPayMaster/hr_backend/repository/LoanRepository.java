package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.model.Loan;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LoanRepository extends JpaRepository<Loan, UUID> {

    @Query("SELECT l FROM Loan l WHERE l.employee.id = :employeeId AND l.status = com.HRPayMaster.hr_backend.enums.LoanStatus.ACTIVE " +
            "AND l.remainingAmount > 0 ORDER BY l.startDate ASC, l.createdAt ASC, l.id ASC")
    List<Loan> findDeductibleLoans(@Param("employeeId") UUID employeeId);

    List<Loan> findByEmployeeIdAndStatus(UUID employeeId, LoanStatus status);

    @Query("SELECT l FROM Loan l WHERE " +
            "(:employeeId IS NULL OR l.employee.id = :employeeId) AND " +
            "(:status IS NULL OR l.status = :status)")
    Page<Loan> findLoansByCriteria(@Param("employeeId") UUID employeeId,
                                   @Param("status") LoanStatus status,
                                   Pageable pageable);
}

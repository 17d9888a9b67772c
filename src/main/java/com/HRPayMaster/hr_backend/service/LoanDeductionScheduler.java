package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.model.LoanPayment;
import com.HRPayMaster.hr_backend.model.PayrollRun;
import com.HRPayMaster.hr_backend.repository.LoanPaymentRepository;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Plans per-period loan deductions and applies them to the loan ledger. Planning only reads;
 * {@link #applyDeduction} is the single place a loan balance goes down.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoanDeductionScheduler {

    private final LoanRepository loanRepository;
    private final LoanPaymentRepository loanPaymentRepository;

    public List<LoanAllocation> plan(UUID employeeId) {
        List<LoanAllocation> allocations = new ArrayList<>();
        for (Loan loan : loanRepository.findDeductibleLoans(employeeId)) {
            BigDecimal installment = installment(loan);
            if (installment.signum() > 0) {
                allocations.add(new LoanAllocation(loan.getId(), installment));
            }
        }
        return allocations;
    }

    public static BigDecimal installment(Loan loan) {
        if (loan.getStatus() != LoanStatus.ACTIVE || loan.getRemainingAmount() == null
                || loan.getRemainingAmount().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return loan.getMonthlyDeduction().min(loan.getRemainingAmount());
    }

    public static BigDecimal total(List<LoanAllocation> allocations) {
        return allocations.stream()
                .map(LoanAllocation::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Trims the allocations, in order, so their sum does not exceed {@code limit}. Loans at the
     * end of the list absorb the shortfall.
     */
    public static List<LoanAllocation> cap(List<LoanAllocation> allocations, BigDecimal limit) {
        List<LoanAllocation> capped = new ArrayList<>();
        BigDecimal available = limit.max(BigDecimal.ZERO);
        for (LoanAllocation allocation : allocations) {
            BigDecimal amount = allocation.getAmount().min(available);
            if (amount.signum() > 0) {
                capped.add(new LoanAllocation(allocation.getLoanId(), amount));
                available = available.subtract(amount);
            }
        }
        return capped;
    }

    public Loan applyDeduction(Loan loan, BigDecimal amount, PayrollRun payrollRun,
                               LocalDate paymentDate, String source, String notes) {
        if (amount == null || amount.signum() <= 0) {
            throw new ComputationException("Loan deduction must be positive for loan " + loan.getId());
        }
        BigDecimal remaining = loan.getRemainingAmount();
        if (amount.compareTo(remaining) > 0) {
            throw new ComputationException(String.format("Deduction %s exceeds remaining balance %s of loan %s",
                    amount.toPlainString(), remaining.toPlainString(), loan.getId()));
        }

        BigDecimal updated = remaining.subtract(amount).max(BigDecimal.ZERO);
        loan.setRemainingAmount(updated);
        if (updated.signum() == 0) {
            loan.setStatus(LoanStatus.COMPLETED);
            log.info("Loan {} fully repaid", loan.getId());
        }
        Loan saved = loanRepository.save(loan);

        LoanPayment payment = LoanPayment.builder()
                .loan(saved)
                .employee(saved.getEmployee())
                .payrollRun(payrollRun)
                .amount(amount)
                .paymentDate(paymentDate)
                .source(source)
                .notes(notes)
                .build();
        loanPaymentRepository.save(payment);

        log.debug("Applied {} to loan {}, remaining {}", amount, loan.getId(), updated);
        return saved;
    }

    @Getter
    @AllArgsConstructor
    public static class LoanAllocation {
        private final UUID loanId;
        private final BigDecimal amount;
    }
}

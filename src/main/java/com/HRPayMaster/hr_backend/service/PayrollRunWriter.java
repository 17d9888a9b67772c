package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.PayrollStatus;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.model.PayrollEntry;
import com.HRPayMaster.hr_backend.model.PayrollRun;
import com.HRPayMaster.hr_backend.model.ScenarioToggles;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import com.HRPayMaster.hr_backend.repository.PayrollRunDayRepository;
import com.HRPayMaster.hr_backend.repository.PayrollRunRepository;
import com.HRPayMaster.hr_backend.service.LoanDeductionScheduler.LoanAllocation;
import com.HRPayMaster.hr_backend.service.PayrollEntryComposer.ComposedEntry;
import com.HRPayMaster.hr_backend.service.PayrollEntryComposer.RunTotals;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Commits a payroll run as one unit: the run, its entries, the per-day period locks and the
 * loan ledger updates. Anything failing here rolls all of it back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayrollRunWriter {

    private final PayrollRunRepository payrollRunRepository;
    private final PayrollRunDayRepository payrollRunDayRepository;
    private final LoanRepository loanRepository;
    private final LoanDeductionScheduler loanDeductionScheduler;
    private final PayrollPeriodGuard payrollPeriodGuard;

    @Transactional
    public PayrollRun write(String period, LocalDate startDate, LocalDate endDate,
                            ScenarioToggles toggles, List<ComposedEntry> composedEntries) {
        PayrollRun run = PayrollRun.builder()
                .period(period.trim())
                .startDate(startDate)
                .endDate(endDate)
                .status(PayrollStatus.COMPLETED)
                .scenarioToggles(toggles)
                .build();

        for (ComposedEntry composed : composedEntries) {
            run.addEntry(composed.getEntry());
        }

        RunTotals totals = PayrollEntryComposer.totals(run.getEntries());
        run.setGrossAmount(totals.getGrossAmount());
        run.setTotalDeductions(totals.getTotalDeductions());
        run.setNetAmount(totals.getNetAmount());

        PayrollRun saved = payrollRunRepository.saveAndFlush(run);

        try {
            payrollRunDayRepository.saveAllAndFlush(payrollPeriodGuard.dayLocks(saved.getId(), startDate, endDate));
        } catch (DataIntegrityViolationException ex) {
            log.warn("Concurrent payroll run claimed part of {} to {}", startDate, endDate);
            throw new ConflictException(Constants.ERROR_PAYROLL_PERIOD_EXISTS, "payroll_run", null);
        }

        // Loan balances move only once the run and its entries are in place
        for (ComposedEntry composed : composedEntries) {
            applyLoanDeductions(saved, composed, endDate);
        }

        log.info("Payroll run {} created for {} ({} to {}), {} entries, net {}",
                saved.getId(), saved.getPeriod(), startDate, endDate, saved.getEntries().size(), saved.getNetAmount());
        return saved;
    }

    private void applyLoanDeductions(PayrollRun run, ComposedEntry composed, LocalDate paymentDate) {
        PayrollEntry entry = composed.getEntry();
        for (LoanAllocation allocation : composed.getLoanAllocations()) {
            Loan loan = loanRepository.findById(allocation.getLoanId())
                    .orElseThrow(() -> new ComputationException("Loan " + allocation.getLoanId()
                            + " disappeared while generating payroll"));
            loanDeductionScheduler.applyDeduction(loan, allocation.getAmount(), run, paymentDate,
                    Constants.LOAN_PAYMENT_SOURCE_PAYROLL,
                    "Payroll deduction for " + run.getPeriod() + " (" + entry.getEmployee().getEmployeeCode() + ")");
        }
    }
}

package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.config.PayrollProperties;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.PayrollEntry;
import com.HRPayMaster.hr_backend.service.EventAggregator.EventTotals;
import com.HRPayMaster.hr_backend.service.LoanDeductionScheduler.LoanAllocation;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds a payroll entry from the per-employee inputs and totals a run.
 *
 * <p>{@code grossPay = baseSalary + bonusAmount}, {@code netPay = max(0, grossPay - deductions)}.
 * When scheduled deductions exceed gross pay the recorded amounts are trimmed, other deductions
 * first, so that {@code netPay = grossPay - recordedDeductions} holds for every entry.
 */
@Component
@RequiredArgsConstructor
public class PayrollEntryComposer {

    private final PayrollProperties payrollProperties;

    public int standardWorkingDays(Employee employee) {
        Integer days = employee.getStandardWorkingDays();
        return days != null ? days : payrollProperties.getDefaultWorkingDays();
    }

    /**
     * @param vacationDays     merged leave days in the period, {@code null} when vacations are switched off
     * @param events           netted events for the period
     * @param loanAllocations  planned loan installments, {@code null} when loans are switched off
     */
    public ComposedEntry compose(Employee employee, Integer vacationDays, EventTotals events,
                                 List<LoanAllocation> loanAllocations) {
        validateEmployee(employee);

        int workingDays = standardWorkingDays(employee);
        int leaveDays = vacationDays != null ? vacationDays : 0;
        int actualWorkingDays = VacationDayCalculator.actualWorkingDays(workingDays, leaveDays);
        BigDecimal baseSalary = VacationDayCalculator.proratedSalary(employee.getSalary(), actualWorkingDays, workingDays);

        BigDecimal bonusAmount = scale(events.getBonusAmount());
        BigDecimal grossPay = baseSalary.add(bonusAmount != null ? bonusAmount : BigDecimal.ZERO);

        BigDecimal otherDeductions = scale(events.getOtherDeductions());
        if (otherDeductions != null) {
            otherDeductions = otherDeductions.min(grossPay);
        }

        List<LoanAllocation> appliedLoans = List.of();
        BigDecimal loanDeduction = null;
        if (loanAllocations != null) {
            BigDecimal available = grossPay.subtract(otherDeductions != null ? otherDeductions : BigDecimal.ZERO);
            appliedLoans = LoanDeductionScheduler.cap(loanAllocations, available);
            loanDeduction = scale(LoanDeductionScheduler.total(appliedLoans));
        }

        PayrollEntry entry = PayrollEntry.builder()
                .employee(employee)
                .baseSalary(baseSalary)
                .bonusAmount(bonusAmount)
                .allowances(events.getAllowances() != null ? new LinkedHashMap<>(events.getAllowances()) : new LinkedHashMap<>())
                .allowancesTracked(events.getAllowances() != null)
                .workingDays(workingDays)
                .actualWorkingDays(actualWorkingDays)
                .vacationDays(vacationDays)
                .taxDeduction(zero())
                .socialSecurityDeduction(zero())
                .healthInsuranceDeduction(zero())
                .loanDeduction(loanDeduction)
                .otherDeductions(otherDeductions)
                .grossPay(grossPay)
                .build();
        entry.setNetPay(netPay(entry));
        entry.setAdjustmentReason(adjustmentReason(leaveDays, loanDeduction));

        return new ComposedEntry(entry, appliedLoans);
    }

    public static BigDecimal netPay(PayrollEntry entry) {
        return entry.getGrossPay().subtract(entry.getTotalDeductions()).max(BigDecimal.ZERO);
    }

    /**
     * Re-derives gross and net pay from an entry's stored components.
     */
    public static void recompute(PayrollEntry entry) {
        BigDecimal bonus = entry.getBonusAmount() != null ? entry.getBonusAmount() : BigDecimal.ZERO;
        entry.setGrossPay(entry.getBaseSalary().add(bonus));
        entry.setNetPay(netPay(entry));
    }

    public static RunTotals totals(List<PayrollEntry> entries) {
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal deductions = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;
        for (PayrollEntry entry : entries) {
            gross = gross.add(entry.getGrossPay());
            deductions = deductions.add(entry.getTotalDeductions());
            net = net.add(entry.getNetPay());
        }
        if (gross.subtract(deductions).compareTo(net) != 0) {
            throw new ComputationException(String.format("Payroll totals do not balance: gross %s, deductions %s, net %s",
                    gross.toPlainString(), deductions.toPlainString(), net.toPlainString()));
        }
        return new RunTotals(gross, deductions, net);
    }

    private void validateEmployee(Employee employee) {
        if (employee.getSalary() == null || employee.getSalary().signum() < 0) {
            throw new ComputationException("Employee " + employee.getEmployeeCode() + " has no valid salary");
        }
        int workingDays = standardWorkingDays(employee);
        if (workingDays <= 0) {
            throw new ComputationException("Employee " + employee.getEmployeeCode()
                    + " has invalid standard working days: " + workingDays);
        }
    }

    private String adjustmentReason(int vacationDays, BigDecimal loanDeduction) {
        StringBuilder reason = new StringBuilder();
        if (vacationDays > 0) {
            reason.append(vacationDays).append(" vacation days. ");
        }
        if (loanDeduction != null && loanDeduction.signum() > 0) {
            reason.append("Loan deduction: ").append(loanDeduction.toPlainString())
                    .append(' ').append(payrollProperties.getCurrency()).append(". ");
        }
        String text = reason.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static BigDecimal scale(BigDecimal value) {
        return value != null ? value.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP) : null;
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(Constants.MONEY_SCALE);
    }

    @Getter
    @AllArgsConstructor
    public static class ComposedEntry {
        private final PayrollEntry entry;
        private final List<LoanAllocation> loanAllocations;
    }

    @Getter
    @AllArgsConstructor
    public static class RunTotals {
        private final BigDecimal grossAmount;
        private final BigDecimal totalDeductions;
        private final BigDecimal netAmount;
    }
}

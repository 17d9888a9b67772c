package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.config.PayrollProperties;
import com.HRPayMaster.hr_backend.dto.request.PayrollEntryUpdateRequest;
import com.HRPayMaster.hr_backend.dto.request.PayrollGenerationRequest;
import com.HRPayMaster.hr_backend.dto.request.ScenarioTogglesRequest;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.dto.response.PayrollEntryResponse;
import com.HRPayMaster.hr_backend.dto.response.PayrollRunResponse;
import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import com.HRPayMaster.hr_backend.enums.NotificationPriority;
import com.HRPayMaster.hr_backend.enums.NotificationType;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.PayrollEntry;
import com.HRPayMaster.hr_backend.model.PayrollRun;
import com.HRPayMaster.hr_backend.model.ScenarioToggles;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.LoanPaymentRepository;
import com.HRPayMaster.hr_backend.repository.PayrollEntryRepository;
import com.HRPayMaster.hr_backend.repository.PayrollRunDayRepository;
import com.HRPayMaster.hr_backend.repository.PayrollRunRepository;
import com.HRPayMaster.hr_backend.service.EventAggregator.EventTotals;
import com.HRPayMaster.hr_backend.service.LoanDeductionScheduler.LoanAllocation;
import com.HRPayMaster.hr_backend.service.PayrollEntryComposer.ComposedEntry;
import com.HRPayMaster.hr_backend.service.PayrollEntryComposer.RunTotals;
import com.HRPayMaster.hr_backend.util.PayrollExportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollService {

    // Employees on approved leave are still paid, their leave days are prorated out
    private static final Set<EmployeeStatus> PAYABLE_STATUSES = EnumSet.of(EmployeeStatus.ACTIVE, EmployeeStatus.ON_LEAVE);

    private final PayrollPeriodGuard payrollPeriodGuard;
    private final VacationDayCalculator vacationDayCalculator;
    private final EventAggregator eventAggregator;
    private final LoanDeductionScheduler loanDeductionScheduler;
    private final PayrollEntryComposer payrollEntryComposer;
    private final PayrollRunWriter payrollRunWriter;
    private final EmployeeRepository employeeRepository;
    private final PayrollRunRepository payrollRunRepository;
    private final PayrollEntryRepository payrollEntryRepository;
    private final PayrollRunDayRepository payrollRunDayRepository;
    private final LoanPaymentRepository loanPaymentRepository;
    private final NotificationService notificationService;
    private final PayrollProperties payrollProperties;

    /**
     * Generates the payroll run for a period. The period checks run before any employee is
     * read; the run, its entries and the loan updates commit together, and notifications go out
     * only after that commit.
     */
    public PayrollRunResponse generatePayroll(PayrollGenerationRequest request) {
        payrollPeriodGuard.validate(request.getPeriod(), request.getStartDate(), request.getEndDate());
        payrollPeriodGuard.checkNoOverlap(request.getStartDate(), request.getEndDate());

        LocalDate startDate = request.getStartDate();
        LocalDate endDate = request.getEndDate();
        ScenarioToggles toggles = toScenarioToggles(request.getScenarioToggles());

        List<Employee> employees = employeeRepository.findByStatusIn(PAYABLE_STATUSES);
        if (employees.isEmpty()) {
            throw new ValidationException("No active employees found");
        }

        List<ComposedEntry> composedEntries = new ArrayList<>();
        for (Employee employee : employees) {
            composedEntries.add(computeEntry(employee, startDate, endDate, toggles));
        }

        PayrollRun run = payrollRunWriter.write(request.getPeriod(), startDate, endDate, toggles, composedEntries);

        notifyAffectedEmployees(run, composedEntries);
        return mapToPayrollRunResponse(run, true);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<PayrollRunResponse> getPayrollRuns(int page, int limit) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("startDate").descending());
        Page<PayrollRun> runs = payrollRunRepository.findAll(pageable);

        List<PayrollRunResponse> responses = runs.getContent()
                .stream()
                .map(run -> mapToPayrollRunResponse(run, false))
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, runs.getTotalElements());
    }

    @Transactional(readOnly = true)
    public PayrollRunResponse getPayrollRun(UUID id) {
        return mapToPayrollRunResponse(findRun(id), true);
    }

    @Transactional(readOnly = true)
    public byte[] exportPayrollRun(UUID id) {
        PayrollRunResponse run = mapToPayrollRunResponse(findRun(id), true);
        return PayrollExportGenerator.generatePayrollRunExcel(run, payrollProperties.getCurrency());
    }

    /**
     * Re-derives every entry's gross and net pay from its stored components and re-totals the run.
     */
    @Transactional
    public PayrollRunResponse recalculate(UUID id) {
        PayrollRun run = findRun(id);
        if (run.getEntries().isEmpty()) {
            throw new ResourceNotFoundException("Payroll entries", "payrollRunId", id);
        }

        run.getEntries().forEach(PayrollEntryComposer::recompute);
        applyTotals(run);

        PayrollRun saved = payrollRunRepository.save(run);
        log.info("Payroll run {} recalculated, net {}", id, saved.getNetAmount());
        return mapToPayrollRunResponse(saved, true);
    }

    @Transactional
    public PayrollEntryResponse updateEntry(UUID entryId, PayrollEntryUpdateRequest request) {
        PayrollEntry entry = payrollEntryRepository.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException("Payroll entry", "id", entryId));

        if (request.getBonusAmount() != null) {
            entry.setBonusAmount(request.getBonusAmount());
        }
        if (request.getOtherDeductions() != null) {
            entry.setOtherDeductions(request.getOtherDeductions());
        }
        if (request.getAdjustmentReason() != null) {
            entry.setAdjustmentReason(request.getAdjustmentReason());
        }

        PayrollEntryComposer.recompute(entry);
        if (entry.getTotalDeductions().compareTo(entry.getGrossPay()) > 0) {
            throw ValidationException.forField("payrollEntryUpdateRequest", "otherDeductions",
                    "Deductions cannot exceed gross pay of " + entry.getGrossPay().toPlainString());
        }

        PayrollRun run = entry.getPayrollRun();
        applyTotals(run);
        payrollRunRepository.save(run);

        log.info("Payroll entry {} adjusted in run {}", entryId, run.getId());
        return mapToEntryResponse(entry);
    }

    /**
     * Deletes a run with its entries and day locks. Loan balances are not restored; the loan
     * payments the run produced stay on the loans, detached from the run.
     */
    @Transactional
    public void deletePayrollRun(UUID id) {
        PayrollRun run = findRun(id);

        int detached = loanPaymentRepository.detachFromPayrollRun(id);
        payrollRunDayRepository.deleteByPayrollRunId(id);
        payrollRunRepository.delete(run);

        log.info("Payroll run {} ({}) deleted, {} loan payments detached", id, run.getPeriod(), detached);
    }

    private ComposedEntry computeEntry(Employee employee, LocalDate startDate, LocalDate endDate, ScenarioToggles toggles) {
        Integer vacationDays = toggles.isVacations()
                ? vacationDayCalculator.vacationDays(employee.getId(), startDate, endDate)
                : null;
        EventTotals events = eventAggregator.aggregate(employee.getId(), startDate, endDate, toggles);
        List<LoanAllocation> loans = toggles.isLoans()
                ? loanDeductionScheduler.plan(employee.getId())
                : null;
        return payrollEntryComposer.compose(employee, vacationDays, events, loans);
    }

    private void notifyAffectedEmployees(PayrollRun run, List<ComposedEntry> composedEntries) {
        for (ComposedEntry composed : composedEntries) {
            PayrollEntry entry = composed.getEntry();
            UUID employeeId = entry.getEmployee().getId();

            if (entry.getVacationDays() != null && entry.getVacationDays() > 0) {
                sendQuietly(employeeId, NotificationType.VACATION_APPROVED,
                        String.format("%d vacation days deducted from %s payroll", entry.getVacationDays(), run.getPeriod()),
                        NotificationPriority.MEDIUM, run);
            }
            if (entry.getLoanDeduction() != null && entry.getLoanDeduction().signum() > 0) {
                sendQuietly(employeeId, NotificationType.LOAN_DEDUCTION,
                        String.format("%s %s deducted for loan repayment in %s",
                                entry.getLoanDeduction().toPlainString(), payrollProperties.getCurrency(), run.getPeriod()),
                        NotificationPriority.LOW, run);
            }
        }
    }

    private void sendQuietly(UUID employeeId, NotificationType type, String message,
                             NotificationPriority priority, PayrollRun run) {
        try {
            notificationService.notify(employeeId, type, message, priority, run.getId(), run.getEndDate());
        } catch (RuntimeException ex) {
            log.warn("Failed to send {} notification to employee {} for payroll run {}: {}",
                    type.getValue(), employeeId, run.getId(), ex.getMessage());
        }
    }

    private void applyTotals(PayrollRun run) {
        RunTotals totals = PayrollEntryComposer.totals(run.getEntries());
        run.setGrossAmount(totals.getGrossAmount());
        run.setTotalDeductions(totals.getTotalDeductions());
        run.setNetAmount(totals.getNetAmount());
    }

    private PayrollRun findRun(UUID id) {
        return payrollRunRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Payroll run", "id", id));
    }

    static ScenarioToggles toScenarioToggles(ScenarioTogglesRequest request) {
        ScenarioToggles toggles = ScenarioToggles.allEnabled();
        if (request == null) {
            return toggles;
        }
        if (request.getAllowances() != null) {
            toggles.setAllowances(request.getAllowances());
        }
        if (request.getBonuses() != null) {
            toggles.setBonuses(request.getBonuses());
        }
        if (request.getDeductions() != null) {
            toggles.setDeductions(request.getDeductions());
        }
        if (request.getLoans() != null) {
            toggles.setLoans(request.getLoans());
        }
        if (request.getVacations() != null) {
            toggles.setVacations(request.getVacations());
        }
        return toggles;
    }

    private PayrollRunResponse mapToPayrollRunResponse(PayrollRun run, boolean includeEntries) {
        ScenarioToggles toggles = run.getScenarioToggles() != null ? run.getScenarioToggles() : ScenarioToggles.allEnabled();
        Map<String, Boolean> toggleMap = new LinkedHashMap<>();
        toggleMap.put("allowances", toggles.isAllowances());
        toggleMap.put("bonuses", toggles.isBonuses());
        toggleMap.put("deductions", toggles.isDeductions());
        toggleMap.put("loans", toggles.isLoans());
        toggleMap.put("vacations", toggles.isVacations());

        PayrollRunResponse.PayrollRunResponseBuilder builder = PayrollRunResponse.builder()
                .id(run.getId())
                .period(run.getPeriod())
                .startDate(run.getStartDate())
                .endDate(run.getEndDate())
                .grossAmount(run.getGrossAmount())
                .totalDeductions(run.getTotalDeductions())
                .netAmount(run.getNetAmount())
                .status(run.getStatus())
                .scenarioToggles(toggleMap)
                .employeeCount(run.getEntries().size())
                .createdAt(run.getCreatedAt());

        if (includeEntries) {
            TreeSet<String> allowanceKeys = new TreeSet<>();
            List<PayrollEntryResponse> entries = new ArrayList<>();
            for (PayrollEntry entry : run.getEntries()) {
                if (entry.isAllowancesTracked()) {
                    allowanceKeys.addAll(entry.getAllowances().keySet());
                }
                entries.add(mapToEntryResponse(entry));
            }
            builder.entries(entries).allowanceKeys(new ArrayList<>(allowanceKeys));
        }
        return builder.build();
    }

    private PayrollEntryResponse mapToEntryResponse(PayrollEntry entry) {
        Employee employee = entry.getEmployee();
        Map<String, BigDecimal> allowances = entry.isAllowancesTracked()
                ? new LinkedHashMap<>(entry.getAllowances())
                : null;

        return PayrollEntryResponse.builder()
                .id(entry.getId())
                .employeeId(employee.getId())
                .employeeName(employee.getFullName())
                .employeeCode(employee.getEmployeeCode())
                .baseSalary(entry.getBaseSalary())
                .bonusAmount(entry.getBonusAmount())
                .allowances(allowances)
                .workingDays(entry.getWorkingDays())
                .actualWorkingDays(entry.getActualWorkingDays())
                .vacationDays(entry.getVacationDays())
                .taxDeduction(entry.getTaxDeduction())
                .socialSecurityDeduction(entry.getSocialSecurityDeduction())
                .healthInsuranceDeduction(entry.getHealthInsuranceDeduction())
                .loanDeduction(entry.getLoanDeduction())
                .otherDeductions(entry.getOtherDeductions())
                .grossPay(entry.getGrossPay())
                .netPay(entry.getNetPay())
                .adjustmentReason(entry.getAdjustmentReason())
                .build();
    }
}

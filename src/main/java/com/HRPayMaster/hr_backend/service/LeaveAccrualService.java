package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.LeavePolicyAssignmentRequest;
import com.HRPayMaster.hr_backend.dto.request.LeavePolicyRequest;
import com.HRPayMaster.hr_backend.dto.response.LeaveBalanceResponse;
import com.HRPayMaster.hr_backend.dto.response.LeavePolicyAssignmentResponse;
import com.HRPayMaster.hr_backend.dto.response.LeavePolicyResponse;
import com.HRPayMaster.hr_backend.dto.response.LedgerEntryResponse;
import com.HRPayMaster.hr_backend.enums.LedgerEntryType;
import com.HRPayMaster.hr_backend.exception.InsufficientLeaveBalanceException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.EmployeeLeavePolicy;
import com.HRPayMaster.hr_backend.model.LeaveAccrualLedgerEntry;
import com.HRPayMaster.hr_backend.model.LeaveAccrualPolicy;
import com.HRPayMaster.hr_backend.model.LeaveBalance;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.EmployeeLeavePolicyRepository;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.LeaveAccrualLedgerRepository;
import com.HRPayMaster.hr_backend.repository.LeaveAccrualPolicyRepository;
import com.HRPayMaster.hr_backend.repository.LeaveBalanceRepository;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maintains per-year leave balances from policy assignments. Every movement of a balance is
 * written to the accrual ledger, and the ledger's unique key makes re-running a sync a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveAccrualService {

    private static final String ASSIGNMENT_SOURCE = "assignment:";
    private static final String VACATION_SOURCE = "vacation:";
    private static final String YEAR_SOURCE = "year:";

    private final LeaveAccrualPolicyRepository policyRepository;
    private final EmployeeLeavePolicyRepository assignmentRepository;
    private final LeaveBalanceRepository leaveBalanceRepository;
    private final LeaveAccrualLedgerRepository ledgerRepository;
    private final EmployeeRepository employeeRepository;
    private final Clock clock;

    @Transactional
    public LeavePolicyResponse createPolicy(LeavePolicyRequest request) {
        if (request.getExpiresOn() != null && request.getExpiresOn().isBefore(request.getEffectiveFrom())) {
            throw ValidationException.forField("leavePolicy", "expiresOn", "Expiry date must not precede the effective date");
        }

        LeaveAccrualPolicy policy = LeaveAccrualPolicy.builder()
                .name(request.getName().trim())
                .leaveType(normalizeLeaveType(request.getLeaveType()))
                .accrualRatePerMonth(scale(request.getAccrualRatePerMonth()))
                .maxBalanceDays(scale(request.getMaxBalanceDays()))
                .carryoverLimitDays(scale(request.getCarryoverLimitDays()))
                .allowNegativeBalance(Boolean.TRUE.equals(request.getAllowNegativeBalance()))
                .effectiveFrom(request.getEffectiveFrom())
                .expiresOn(request.getExpiresOn())
                .build();

        LeaveAccrualPolicy saved = policyRepository.save(policy);
        log.info("Leave policy '{}' created for leave type {}", saved.getName(), saved.getLeaveType());
        return mapToPolicyResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<LeavePolicyResponse> getPolicies(String leaveType) {
        List<LeaveAccrualPolicy> policies = leaveType == null || leaveType.isBlank()
                ? policyRepository.findAll()
                : policyRepository.findByLeaveTypeIgnoreCase(leaveType.trim());
        return policies.stream().map(this::mapToPolicyResponse).collect(Collectors.toList());
    }

    @Transactional
    public LeavePolicyAssignmentResponse assignPolicy(LeavePolicyAssignmentRequest request) {
        Employee employee = findEmployee(request.getEmployeeId());
        LeaveAccrualPolicy policy = policyRepository.findById(request.getPolicyId())
                .orElseThrow(() -> new ResourceNotFoundException("Leave policy", "id", request.getPolicyId()));

        if (request.getEffectiveTo() != null && request.getEffectiveTo().isBefore(request.getEffectiveFrom())) {
            throw ValidationException.forField("assignment", "effectiveTo", "End date must not precede the effective date");
        }

        EmployeeLeavePolicy assignment = EmployeeLeavePolicy.builder()
                .employee(employee)
                .policy(policy)
                .effectiveFrom(request.getEffectiveFrom())
                .effectiveTo(request.getEffectiveTo())
                .customAccrualRate(scale(request.getCustomAccrualRate()))
                .build();

        EmployeeLeavePolicy saved = assignmentRepository.save(assignment);
        log.info("Leave policy {} assigned to employee {} from {}", policy.getId(), employee.getId(), saved.getEffectiveFrom());
        return mapToAssignmentResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<LeavePolicyAssignmentResponse> getAssignments(UUID employeeId) {
        findEmployee(employeeId);
        return assignmentRepository.findByEmployeeId(employeeId).stream()
                .map(this::mapToAssignmentResponse)
                .collect(Collectors.toList());
    }

    /**
     * Brings the balance up to date (carryover, then accruals through today or year end) and
     * returns it.
     */
    @Transactional
    public LeaveBalanceResponse getLeaveBalance(UUID employeeId, String leaveType, int year) {
        Employee employee = findEmployee(employeeId);
        return mapToBalanceResponse(syncBalance(employee, normalizeLeaveType(leaveType), year));
    }

    @Transactional
    public List<LeaveBalanceResponse> getLeaveBalances(UUID employeeId, int year) {
        Employee employee = findEmployee(employeeId);
        List<String> leaveTypes = assignmentRepository.findByEmployeeId(employeeId).stream()
                .map(assignment -> normalizeLeaveType(assignment.getPolicy().getLeaveType()))
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        List<LeaveBalanceResponse> balances = new ArrayList<>();
        for (String leaveType : leaveTypes) {
            balances.add(mapToBalanceResponse(syncBalance(employee, leaveType, year)));
        }
        return balances;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntryResponse> getLedger(UUID employeeId) {
        findEmployee(employeeId);
        return ledgerRepository.findByEmployeeIdOrderByEntryDateAscCreatedAtAsc(employeeId).stream()
                .map(this::mapToLedgerResponse)
                .collect(Collectors.toList());
    }

    /**
     * Takes the request's days from the balance of the year it starts in. Returns the days
     * consumed, zero when no policy tracks the leave type for this employee.
     *
     * @throws InsufficientLeaveBalanceException when the balance would go negative and no
     *                                           applicable policy allows that
     */
    @Transactional
    public BigDecimal consume(VacationRequest request) {
        Employee employee = request.getEmployee();
        String leaveType = normalizeLeaveType(request.getLeaveType());
        List<EmployeeLeavePolicy> assignments = assignmentRepository.findAssignments(employee.getId(), leaveType);

        if (assignments.isEmpty() && request.getAppliedPolicy() == null) {
            log.debug("Leave type {} is not tracked for employee {}, nothing consumed", leaveType, employee.getId());
            return BigDecimal.ZERO;
        }

        int year = request.getStartDate().getYear();
        LeaveBalance balance = syncBalance(employee, leaveType, year);
        BigDecimal requested = BigDecimal.valueOf(request.getDays()).setScale(Constants.MONEY_SCALE);
        BigDecimal remaining = balance.getBalanceDays().subtract(requested);

        if (remaining.signum() < 0 && !allowsNegativeBalance(request, assignments)) {
            throw new InsufficientLeaveBalanceException(leaveType, balance.getBalanceDays(), requested);
        }

        String sourceKey = VACATION_SOURCE + request.getId();
        balance.setUsedDays(balance.getUsedDays().add(requested));
        balance.recomputeBalance();
        leaveBalanceRepository.save(balance);

        appendLedger(employee, policyFor(request, assignments), leaveType, LedgerEntryType.CONSUMPTION,
                request.getStartDate(), sourceKey, requested.negate(), "Approved leave " + request.getStartDate()
                        + " to " + request.getEndDate());
        rollForward(employee, leaveType, balance, requested.negate(), sourceKey, assignments);

        log.info("Consumed {} {} days for employee {}, balance now {}",
                requested, leaveType, employee.getId(), balance.getBalanceDays());
        return requested;
    }

    /**
     * Gives back what {@link #consume} took for the request.
     */
    @Transactional
    public void restore(VacationRequest request) {
        BigDecimal consumed = request.getConsumedDays();
        if (consumed == null || consumed.signum() <= 0) {
            return;
        }

        Employee employee = request.getEmployee();
        String leaveType = normalizeLeaveType(request.getLeaveType());
        int year = request.getStartDate().getYear();
        LeaveBalance balance = syncBalance(employee, leaveType, year);

        BigDecimal before = balance.getBalanceDays();
        balance.setUsedDays(balance.getUsedDays().subtract(consumed).max(BigDecimal.ZERO));
        balance.recomputeBalance();
        leaveBalanceRepository.save(balance);

        List<EmployeeLeavePolicy> assignments = assignmentRepository.findAssignments(employee.getId(), leaveType);
        appendLedger(employee, policyFor(request, assignments), leaveType, LedgerEntryType.RESTORATION,
                LocalDate.now(clock), VACATION_SOURCE + request.getId(), consumed, "Leave cancelled");
        rollForward(employee, leaveType, balance, balance.getBalanceDays().subtract(before),
                VACATION_SOURCE + request.getId() + ":restore", assignments);

        log.info("Restored {} {} days for employee {}, balance now {}",
                consumed, leaveType, employee.getId(), balance.getBalanceDays());
    }

    LeaveBalance syncBalance(Employee employee, String leaveType, int year) {
        LocalDate today = LocalDate.now(clock);
        LocalDate yearStart = LocalDate.of(year, 1, 1);
        LocalDate yearEnd = LocalDate.of(year, 12, 31);
        LocalDate asOf = today.isBefore(yearEnd) ? today : yearEnd;

        List<EmployeeLeavePolicy> assignments = assignmentRepository.findAssignments(employee.getId(), leaveType);

        LeaveBalance balance = leaveBalanceRepository
                .findByEmployeeIdAndLeaveTypeIgnoreCaseAndYear(employee.getId(), leaveType, year)
                .orElseGet(() -> LeaveBalance.builder()
                        .employee(employee)
                        .leaveType(leaveType)
                        .year(year)
                        .build());

        // The prior year is only closed once this year has started
        if (!balance.isCarryoverApplied() && !today.isBefore(yearStart)) {
            applyCarryover(employee, leaveType, year, balance, assignments);
        }

        List<AccrualSlot> slots = new ArrayList<>();
        for (EmployeeLeavePolicy assignment : assignments) {
            LocalDate start = accrualStart(assignment);
            LocalDate end = accrualEnd(assignment, asOf);
            for (LocalDate date : accrualDates(start, end, year)) {
                slots.add(new AccrualSlot(assignment, date));
            }
        }
        slots.sort(Comparator.comparing(AccrualSlot::getDate));

        for (AccrualSlot slot : slots) {
            accrue(employee, leaveType, balance, slot);
        }

        balance.recomputeBalance();
        return leaveBalanceRepository.save(balance);
    }

    private void accrue(Employee employee, String leaveType, LeaveBalance balance, AccrualSlot slot) {
        EmployeeLeavePolicy assignment = slot.getAssignment();
        String sourceKey = ASSIGNMENT_SOURCE + assignment.getId();
        if (ledgerRepository.existsByEmployeeIdAndLeaveTypeAndEntryTypeAndEntryDateAndSourceKey(
                employee.getId(), leaveType, LedgerEntryType.ACCRUAL, slot.getDate(), sourceKey)) {
            return;
        }

        balance.recomputeBalance();
        BigDecimal amount = cappedAccrual(assignment.getEffectiveRate(),
                balance.getBalanceDays(), assignment.getPolicy().getMaxBalanceDays());

        balance.setAccruedDays(balance.getAccruedDays().add(amount));
        if (balance.getLastAccrualDate() == null || slot.getDate().isAfter(balance.getLastAccrualDate())) {
            balance.setLastAccrualDate(slot.getDate());
        }

        // Zero lines are kept so a capped month is not re-evaluated after the balance drops
        appendLedger(employee, assignment.getPolicy(), leaveType, LedgerEntryType.ACCRUAL, slot.getDate(), sourceKey,
                amount, amount.signum() == 0 ? "Capped at maximum balance" : null);
    }

    private void applyCarryover(Employee employee, String leaveType, int year, LeaveBalance balance,
                                List<EmployeeLeavePolicy> assignments) {
        int priorYear = year - 1;
        boolean hasPriorYear = leaveBalanceRepository
                .findByEmployeeIdAndLeaveTypeIgnoreCaseAndYear(employee.getId(), leaveType, priorYear)
                .isPresent()
                || assignments.stream().anyMatch(a -> accrualStart(a).getYear() <= priorYear);

        if (hasPriorYear) {
            LeaveBalance prior = syncBalance(employee, leaveType, priorYear);
            LocalDate boundary = LocalDate.of(year, 1, 1);
            LeaveAccrualPolicy policy = policyAt(assignments, boundary.minusDays(1));
            BigDecimal limit = policy != null ? policy.getCarryoverLimitDays() : null;

            BigDecimal closing = prior.getBalanceDays();
            BigDecimal carried = carryover(closing, limit);
            BigDecimal forfeited = closing.subtract(carried);
            String sourceKey = YEAR_SOURCE + priorYear;

            balance.setCarriedOverDays(carried);
            appendLedger(employee, policy, leaveType, LedgerEntryType.CARRYOVER, boundary, sourceKey,
                    carried, "Carried over from " + priorYear);
            if (forfeited.signum() > 0) {
                appendLedger(employee, policy, leaveType, LedgerEntryType.CARRYOVER_FORFEIT, boundary, sourceKey,
                        forfeited.negate(), "Exceeded carryover limit of " + limit.toPlainString());
                log.info("Employee {} forfeited {} {} days at the {} year boundary",
                        employee.getId(), forfeited, leaveType, year);
            }
        }
        balance.setCarryoverApplied(true);
    }

    /**
     * Re-derives the carryover of every later year that has already been opened after
     * {@code changed} moved by {@code closingDelta}, writing adjusting CARRYOVER and
     * CARRYOVER_FORFEIT lines keyed by {@code trigger}.
     */
    private void rollForward(Employee employee, String leaveType, LeaveBalance changed, BigDecimal closingDelta,
                             String trigger, List<EmployeeLeavePolicy> assignments) {
        LeaveBalance prior = changed;
        BigDecimal delta = closingDelta;

        while (delta.signum() != 0) {
            int year = prior.getYear() + 1;
            LeaveBalance successor = leaveBalanceRepository
                    .findByEmployeeIdAndLeaveTypeIgnoreCaseAndYear(employee.getId(), leaveType, year)
                    .filter(LeaveBalance::isCarryoverApplied)
                    .orElse(null);
            if (successor == null) {
                return;
            }

            LocalDate boundary = LocalDate.of(year, 1, 1);
            LeaveAccrualPolicy policy = policyAt(assignments, boundary.minusDays(1));
            BigDecimal limit = policy != null ? policy.getCarryoverLimitDays() : null;
            BigDecimal carried = carryover(prior.getBalanceDays(), limit);
            BigDecimal carriedDelta = carried.subtract(successor.getCarriedOverDays());
            BigDecimal forfeitDelta = delta.subtract(carriedDelta);
            String sourceKey = YEAR_SOURCE + prior.getYear() + ":" + trigger;

            if (carriedDelta.signum() != 0) {
                appendLedger(employee, policy, leaveType, LedgerEntryType.CARRYOVER, boundary, sourceKey,
                        carriedDelta, "Carryover from " + prior.getYear() + " adjusted");
            }
            if (forfeitDelta.signum() != 0) {
                appendLedger(employee, policy, leaveType, LedgerEntryType.CARRYOVER_FORFEIT, boundary, sourceKey,
                        forfeitDelta.negate(), "Forfeit from " + prior.getYear() + " adjusted");
            }

            successor.setCarriedOverDays(carried);
            successor.recomputeBalance();
            leaveBalanceRepository.save(successor);
            log.info("Carryover into {} for employee {} {} adjusted by {}, balance now {}",
                    year, employee.getId(), leaveType, carriedDelta, successor.getBalanceDays());

            prior = successor;
            delta = carriedDelta;
        }
    }

    private void appendLedger(Employee employee, LeaveAccrualPolicy policy, String leaveType, LedgerEntryType type,
                              LocalDate date, String sourceKey, BigDecimal amount, String notes) {
        if (ledgerRepository.existsByEmployeeIdAndLeaveTypeAndEntryTypeAndEntryDateAndSourceKey(
                employee.getId(), leaveType, type, date, sourceKey)) {
            log.debug("Ledger line {} {} {} already recorded", type, date, sourceKey);
            return;
        }
        ledgerRepository.save(LeaveAccrualLedgerEntry.builder()
                .employee(employee)
                .policy(policy)
                .leaveType(leaveType)
                .entryType(type)
                .entryDate(date)
                .sourceKey(sourceKey)
                .amount(amount)
                .notes(notes)
                .build());
    }

    /**
     * Accrual dates for an assignment window: {@code start + k months} for k ≥ 1, up to and
     * including {@code end}, restricted to {@code year}.
     */
    public static List<LocalDate> accrualDates(LocalDate start, LocalDate end, int year) {
        List<LocalDate> dates = new ArrayList<>();
        if (start == null || end == null || end.isBefore(start) || end.getYear() < year) {
            return dates;
        }
        for (int k = 1; ; k++) {
            LocalDate date = start.plusMonths(k);
            if (date.isAfter(end) || date.getYear() > year) {
                break;
            }
            if (date.getYear() == year) {
                dates.add(date);
            }
        }
        return dates;
    }

    /**
     * The monthly amount that still fits under {@code maxBalance}; the full rate when there is
     * no maximum.
     */
    public static BigDecimal cappedAccrual(BigDecimal rate, BigDecimal currentBalance, BigDecimal maxBalance) {
        BigDecimal amount = scale(rate);
        if (maxBalance == null) {
            return amount;
        }
        BigDecimal headroom = maxBalance.subtract(currentBalance).max(BigDecimal.ZERO);
        return amount.min(headroom).setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Days carried into the next year. A negative closing balance carries over in full, no
     * limit carries everything.
     */
    public static BigDecimal carryover(BigDecimal closingBalance, BigDecimal limit) {
        if (closingBalance.signum() <= 0 || limit == null) {
            return closingBalance;
        }
        return closingBalance.min(limit);
    }

    private static LocalDate accrualStart(EmployeeLeavePolicy assignment) {
        LocalDate policyStart = assignment.getPolicy().getEffectiveFrom();
        return policyStart.isAfter(assignment.getEffectiveFrom()) ? policyStart : assignment.getEffectiveFrom();
    }

    private static LocalDate accrualEnd(EmployeeLeavePolicy assignment, LocalDate asOf) {
        LocalDate end = asOf;
        if (assignment.getEffectiveTo() != null && assignment.getEffectiveTo().isBefore(end)) {
            end = assignment.getEffectiveTo();
        }
        LocalDate expiresOn = assignment.getPolicy().getExpiresOn();
        if (expiresOn != null && expiresOn.isBefore(end)) {
            end = expiresOn;
        }
        return end;
    }

    private static LeaveAccrualPolicy policyAt(List<EmployeeLeavePolicy> assignments, LocalDate date) {
        LeaveAccrualPolicy latest = null;
        for (EmployeeLeavePolicy assignment : assignments) {
            if (!accrualStart(assignment).isAfter(date) && !accrualEnd(assignment, date).isBefore(date)) {
                return assignment.getPolicy();
            }
            latest = assignment.getPolicy();
        }
        return latest;
    }

    private static LeaveAccrualPolicy policyFor(VacationRequest request, List<EmployeeLeavePolicy> assignments) {
        if (request.getAppliedPolicy() != null) {
            return request.getAppliedPolicy();
        }
        return policyAt(assignments, request.getStartDate());
    }

    private static boolean allowsNegativeBalance(VacationRequest request, List<EmployeeLeavePolicy> assignments) {
        LeaveAccrualPolicy policy = policyFor(request, assignments);
        return policy != null && policy.isAllowNegativeBalance();
    }

    private static String normalizeLeaveType(String leaveType) {
        if (leaveType == null || leaveType.isBlank()) {
            throw ValidationException.forField("leave", "leaveType", "Leave type is required");
        }
        return leaveType.trim().toLowerCase();
    }

    private static BigDecimal scale(BigDecimal value) {
        return value != null ? value.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP) : null;
    }

    private Employee findEmployee(UUID employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", employeeId));
    }

    private LeavePolicyResponse mapToPolicyResponse(LeaveAccrualPolicy policy) {
        return LeavePolicyResponse.builder()
                .id(policy.getId())
                .name(policy.getName())
                .leaveType(policy.getLeaveType())
                .accrualRatePerMonth(policy.getAccrualRatePerMonth())
                .maxBalanceDays(policy.getMaxBalanceDays())
                .carryoverLimitDays(policy.getCarryoverLimitDays())
                .allowNegativeBalance(policy.isAllowNegativeBalance())
                .effectiveFrom(policy.getEffectiveFrom())
                .expiresOn(policy.getExpiresOn())
                .build();
    }

    private LeavePolicyAssignmentResponse mapToAssignmentResponse(EmployeeLeavePolicy assignment) {
        return LeavePolicyAssignmentResponse.builder()
                .id(assignment.getId())
                .employeeId(assignment.getEmployee().getId())
                .policyId(assignment.getPolicy().getId())
                .policyName(assignment.getPolicy().getName())
                .leaveType(assignment.getPolicy().getLeaveType())
                .effectiveFrom(assignment.getEffectiveFrom())
                .effectiveTo(assignment.getEffectiveTo())
                .customAccrualRate(assignment.getCustomAccrualRate())
                .build();
    }

    private LeaveBalanceResponse mapToBalanceResponse(LeaveBalance balance) {
        return LeaveBalanceResponse.builder()
                .id(balance.getId())
                .employeeId(balance.getEmployee().getId())
                .leaveType(balance.getLeaveType())
                .year(balance.getYear())
                .accruedDays(balance.getAccruedDays())
                .usedDays(balance.getUsedDays())
                .carriedOverDays(balance.getCarriedOverDays())
                .balanceDays(balance.getBalanceDays())
                .lastAccrualDate(balance.getLastAccrualDate())
                .build();
    }

    private LedgerEntryResponse mapToLedgerResponse(LeaveAccrualLedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .id(entry.getId())
                .policyId(entry.getPolicy() != null ? entry.getPolicy().getId() : null)
                .leaveType(entry.getLeaveType())
                .entryType(entry.getEntryType())
                .entryDate(entry.getEntryDate())
                .sourceKey(entry.getSourceKey())
                .amount(entry.getAmount())
                .notes(entry.getNotes())
                .build();
    }

    @Getter
    @AllArgsConstructor
    private static class AccrualSlot {
        private final EmployeeLeavePolicy assignment;
        private final LocalDate date;
    }
}

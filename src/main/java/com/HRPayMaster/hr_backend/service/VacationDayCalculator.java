package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.VacationRequestRepository;
import com.HRPayMaster.hr_backend.util.Constants;
import com.HRPayMaster.hr_backend.util.DateRangeUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Counts the leave days an employee took inside a payroll period and prorates salary for them.
 * Overlapping requests are merged first so a day is never counted twice.
 */
@Component
@RequiredArgsConstructor
public class VacationDayCalculator {

    // Completed requests were approved leave that has since ended, they still reduce pay
    static final Set<VacationStatus> DEDUCTIBLE_STATUSES = EnumSet.of(VacationStatus.APPROVED, VacationStatus.COMPLETED);

    private final VacationRequestRepository vacationRequestRepository;

    public int vacationDays(UUID employeeId, LocalDate periodStart, LocalDate periodEnd) {
        List<VacationRequest> requests = vacationRequestRepository.findOverlapping(
                employeeId, DEDUCTIBLE_STATUSES, periodStart, periodEnd);
        return countDays(requests, periodStart, periodEnd);
    }

    public static int countDays(List<VacationRequest> requests, LocalDate periodStart, LocalDate periodEnd) {
        List<DateRangeUtil.DateRange> clipped = requests.stream()
                .map(request -> DateRangeUtil.clip(request.getStartDate(), request.getEndDate(), periodStart, periodEnd))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        return DateRangeUtil.countMergedDays(clipped);
    }

    public static int actualWorkingDays(int standardWorkingDays, int vacationDays) {
        return Math.max(0, standardWorkingDays - vacationDays);
    }

    public static BigDecimal proratedSalary(BigDecimal monthlySalary, int actualWorkingDays, int standardWorkingDays) {
        if (standardWorkingDays <= 0) {
            throw new ComputationException("Standard working days must be positive, got " + standardWorkingDays);
        }
        return monthlySalary
                .multiply(BigDecimal.valueOf(actualWorkingDays))
                .divide(BigDecimal.valueOf(standardWorkingDays), Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}

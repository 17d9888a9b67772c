package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.PayrollRun;
import com.HRPayMaster.hr_backend.model.PayrollRunDay;
import com.HRPayMaster.hr_backend.repository.PayrollRunRepository;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.validation.FieldError;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * First gate of payroll generation. Rejects malformed periods and periods that overlap an
 * existing run before any employee data is touched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayrollPeriodGuard {

    private static final String OBJECT_NAME = "payrollGenerationRequest";

    private final PayrollRunRepository payrollRunRepository;

    public void validate(String period, LocalDate startDate, LocalDate endDate) {
        List<FieldError> errors = new ArrayList<>();
        if (period == null || period.isBlank()) {
            errors.add(new FieldError(OBJECT_NAME, "period", "Period is required"));
        }
        if (startDate == null) {
            errors.add(new FieldError(OBJECT_NAME, "startDate", "Start date is required"));
        }
        if (endDate == null) {
            errors.add(new FieldError(OBJECT_NAME, "endDate", "End date is required"));
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            errors.add(new FieldError(OBJECT_NAME, "endDate", "End date must not be before start date"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Period, start date, and end date are required", errors);
        }
    }

    public void checkNoOverlap(LocalDate startDate, LocalDate endDate) {
        List<PayrollRun> overlapping = payrollRunRepository.findOverlapping(startDate, endDate);
        if (!overlapping.isEmpty()) {
            PayrollRun existing = overlapping.get(0);
            log.warn("Payroll generation for {} to {} rejected, overlaps run {} ({})",
                    startDate, endDate, existing.getId(), existing.getPeriod());
            throw new ConflictException(
                    String.format("%s: %s (%s to %s)", Constants.ERROR_PAYROLL_PERIOD_EXISTS,
                            existing.getPeriod(), existing.getStartDate(), existing.getEndDate()),
                    "payroll_run", existing.getId());
        }
    }

    /**
     * One lock row per day of the run. Persisting them fails on the unique day column when
     * another run already claimed any of these days.
     */
    public List<PayrollRunDay> dayLocks(UUID payrollRunId, LocalDate startDate, LocalDate endDate) {
        List<PayrollRunDay> days = new ArrayList<>();
        for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(1)) {
            days.add(PayrollRunDay.builder()
                    .payrollRunId(payrollRunId)
                    .day(day)
                    .build());
        }
        return days;
    }
}

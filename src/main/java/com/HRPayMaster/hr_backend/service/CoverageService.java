package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.config.CoverageProperties;
import com.HRPayMaster.hr_backend.dto.response.CoverageResponse;
import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Department;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.VacationRequestRepository;
import com.HRPayMaster.hr_backend.util.Constants;
import com.HRPayMaster.hr_backend.util.DateRangeUtil;
import com.HRPayMaster.hr_backend.util.DateRangeUtil.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Answers "who is away when": per-day, per-department counts of approved leave, and the
 * leave-interval lookups used to reject conflicting assignments and overlapping requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoverageService {

    private static final int MAX_RANGE_DAYS = 366;
    private static final Set<VacationStatus> APPROVED = EnumSet.of(VacationStatus.APPROVED);

    private final VacationRequestRepository vacationRequestRepository;
    private final CoverageProperties coverageProperties;

    @Transactional(readOnly = true)
    public CoverageResponse checkCoverage(LocalDate startDate, LocalDate endDate, Integer threshold) {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Start date and end date are required");
        }
        if (endDate.isBefore(startDate)) {
            throw ValidationException.forField("coverage", "endDate", "End date must be on or after start date");
        }
        if (DateRangeUtil.inclusiveDays(startDate, endDate) > MAX_RANGE_DAYS) {
            throw ValidationException.forField("coverage", "endDate", "Coverage range cannot exceed " + MAX_RANGE_DAYS + " days");
        }
        int effectiveThreshold = threshold != null ? threshold : coverageProperties.getDefaultThreshold();
        if (effectiveThreshold < 1) {
            throw ValidationException.forField("coverage", "threshold", "Threshold must be at least 1");
        }

        List<VacationRequest> requests = vacationRequestRepository.findAllOverlapping(APPROVED, startDate, endDate);
        CoverageResponse response = tally(requests, startDate, endDate, effectiveThreshold);

        log.debug("Coverage {} to {}: {} approved requests, {} alerts",
                startDate, endDate, requests.size(), response.getAlerts().size());
        return response;
    }

    /**
     * The employee's approved leave covering {@code date}, if any.
     */
    @Transactional(readOnly = true)
    public Optional<VacationRequest> findLeaveConflict(UUID employeeId, LocalDate date) {
        return vacationRequestRepository.findOverlapping(employeeId, APPROVED, date, date)
                .stream()
                .findFirst();
    }

    /**
     * Pending or approved requests of the employee intersecting {@code [startDate, endDate]}.
     */
    @Transactional(readOnly = true)
    public List<VacationRequest> findOverlappingRequests(UUID employeeId, LocalDate startDate, LocalDate endDate) {
        return vacationRequestRepository.findOverlapping(employeeId,
                EnumSet.of(VacationStatus.PENDING, VacationStatus.APPROVED), startDate, endDate);
    }

    /**
     * Counts each employee at most once per day and department, even with overlapping requests.
     */
    public static CoverageResponse tally(List<VacationRequest> requests, LocalDate startDate, LocalDate endDate,
                                         int threshold) {
        Map<LocalDate, Map<String, Set<UUID>>> absent = new TreeMap<>();
        Map<String, String> departments = new TreeMap<>();

        for (VacationRequest request : requests) {
            Optional<DateRange> clipped = DateRangeUtil.clip(request.getStartDate(), request.getEndDate(), startDate, endDate);
            if (clipped.isEmpty()) {
                continue;
            }
            Employee employee = request.getEmployee();
            Department department = employee.getDepartment();
            String key = department != null ? department.getId().toString() : Constants.UNASSIGNED_DEPARTMENT;
            departments.putIfAbsent(key, department != null ? department.getName() : "Unassigned");

            for (LocalDate day = clipped.get().start(); !day.isAfter(clipped.get().end()); day = day.plusDays(1)) {
                absent.computeIfAbsent(day, d -> new TreeMap<>())
                        .computeIfAbsent(key, k -> new HashSet<>())
                        .add(employee.getId());
            }
        }

        Map<LocalDate, Map<String, Integer>> days = new TreeMap<>();
        List<CoverageResponse.Alert> alerts = new ArrayList<>();
        for (Map.Entry<LocalDate, Map<String, Set<UUID>>> day : absent.entrySet()) {
            Map<String, Integer> counts = new HashMap<>();
            for (Map.Entry<String, Set<UUID>> bucket : day.getValue().entrySet()) {
                int count = bucket.getValue().size();
                counts.put(bucket.getKey(), count);
                if (count >= threshold) {
                    alerts.add(CoverageResponse.Alert.builder()
                            .date(day.getKey())
                            .departmentId(bucket.getKey())
                            .departmentName(departments.get(bucket.getKey()))
                            .count(count)
                            .build());
                }
            }
            days.put(day.getKey(), counts);
        }

        return CoverageResponse.builder()
                .startDate(startDate)
                .endDate(endDate)
                .threshold(threshold)
                .days(days)
                .alerts(alerts)
                .departments(departments)
                .build();
    }
}

package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.EventStatus;
import com.HRPayMaster.hr_backend.enums.EventType;
import com.HRPayMaster.hr_backend.model.EmployeeEvent;
import com.HRPayMaster.hr_backend.model.ScenarioToggles;
import com.HRPayMaster.hr_backend.repository.EmployeeEventRepository;
import com.HRPayMaster.hr_backend.util.RecurrenceExpander;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Expands an employee's events into a payroll period and nets them into the bonus and
 * other-deduction figures of a payroll entry.
 */
@Component
@RequiredArgsConstructor
public class EventAggregator {

    private final EmployeeEventRepository employeeEventRepository;

    public EventTotals aggregate(UUID employeeId, LocalDate periodStart, LocalDate periodEnd, ScenarioToggles toggles) {
        List<EmployeeEvent> candidates = employeeEventRepository.findCandidatesForPeriod(
                employeeId, EventStatus.ACTIVE, periodStart, periodEnd);
        return totals(expand(candidates, periodStart, periodEnd), toggles);
    }

    /**
     * Occurrences of the payroll-relevant events inside the period. Cancelled, processed and
     * informational events are dropped.
     */
    public static List<Occurrence> expand(List<EmployeeEvent> events, LocalDate periodStart, LocalDate periodEnd) {
        List<Occurrence> occurrences = new ArrayList<>();
        for (EmployeeEvent event : events) {
            if (!event.isAffectsPayroll() || event.getStatus() != EventStatus.ACTIVE) {
                continue;
            }
            List<LocalDate> dates = RecurrenceExpander.occurrences(event.getEventDate(), event.getRecurrenceType(),
                    event.getRecurrenceEndDate(), periodStart, periodEnd);
            for (LocalDate date : dates) {
                occurrences.add(new Occurrence(event, date));
            }
        }
        return occurrences;
    }

    /**
     * Sums occurrences per category. A category switched off by the toggles yields {@code null}
     * rather than zero.
     */
    public static EventTotals totals(List<Occurrence> occurrences, ScenarioToggles toggles) {
        boolean includeBonuses = toggles.isBonuses();
        boolean includeAllowances = toggles.isAllowances();
        boolean includeDeductions = toggles.isDeductions();

        BigDecimal bonusAmount = BigDecimal.ZERO;
        BigDecimal otherDeductions = BigDecimal.ZERO;
        Map<String, BigDecimal> allowances = new LinkedHashMap<>();

        for (Occurrence occurrence : occurrences) {
            EmployeeEvent event = occurrence.getEvent();
            EventType type = event.getEventType();
            BigDecimal amount = event.getAmount() != null ? event.getAmount() : BigDecimal.ZERO;

            if (type == EventType.ALLOWANCE) {
                if (includeAllowances) {
                    bonusAmount = bonusAmount.add(amount);
                    allowances.merge(allowanceKey(event.getTitle()), amount, BigDecimal::add);
                }
            } else if (type.isAddition()) {
                if (includeBonuses) {
                    bonusAmount = bonusAmount.add(amount);
                }
            } else if (type.isSubtraction()) {
                if (includeDeductions) {
                    otherDeductions = otherDeductions.add(amount);
                }
            }
        }

        return EventTotals.builder()
                .bonusAmount(includeBonuses || includeAllowances ? bonusAmount : null)
                .allowances(includeAllowances ? allowances : null)
                .otherDeductions(includeDeductions ? otherDeductions : null)
                .occurrenceCount(occurrences.size())
                .build();
    }

    /**
     * Breakdown key for an allowance title, e.g. "Housing Allowance" becomes {@code housing}.
     */
    public static String allowanceKey(String title) {
        if (title == null) {
            return "allowance";
        }
        String key = title.trim().toLowerCase(Locale.ROOT)
                .replaceAll("\\s+allowance$", "")
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return key.isEmpty() ? "allowance" : key;
    }

    @Getter
    @AllArgsConstructor
    public static class Occurrence {
        private final EmployeeEvent event;
        private final LocalDate date;
    }

    @Getter
    @Builder
    public static class EventTotals {
        private final BigDecimal bonusAmount;
        private final Map<String, BigDecimal> allowances;
        private final BigDecimal otherDeductions;
        private final int occurrenceCount;
    }
}

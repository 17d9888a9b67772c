package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.EventStatus;
import com.HRPayMaster.hr_backend.enums.EventType;
import com.HRPayMaster.hr_backend.enums.RecurrenceType;
import com.HRPayMaster.hr_backend.model.EmployeeEvent;
import com.HRPayMaster.hr_backend.model.ScenarioToggles;
import com.HRPayMaster.hr_backend.service.EventAggregator.EventTotals;
import com.HRPayMaster.hr_backend.service.EventAggregator.Occurrence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventAggregator")
class EventAggregatorTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 31);

    private static EmployeeEvent event(EventType type, String title, String amount, LocalDate date) {
        return EmployeeEvent.builder()
                .eventType(type)
                .title(title)
                .amount(new BigDecimal(amount))
                .eventDate(date)
                .build();
    }

    @Test
    @DisplayName("Monthly housing allowance, one-off bonus and a penalty net into the entry figures")
    void aggregatesMixedEvents() {
        EmployeeEvent housing = event(EventType.ALLOWANCE, "Housing Allowance", "150.00", LocalDate.of(2024, 1, 5));
        housing.setRecurrenceType(RecurrenceType.MONTHLY);
        List<EmployeeEvent> events = List.of(
                housing,
                event(EventType.BONUS, "Quarterly bonus", "200.00", LocalDate.of(2024, 3, 20)),
                event(EventType.PENALTY, "Late arrival", "25.00", LocalDate.of(2024, 3, 11)));

        List<Occurrence> occurrences = EventAggregator.expand(events, START, END);
        EventTotals totals = EventAggregator.totals(occurrences, ScenarioToggles.allEnabled());

        assertThat(occurrences).hasSize(3);
        assertThat(totals.getBonusAmount()).isEqualByComparingTo("350.00");
        assertThat(totals.getAllowances()).containsOnlyKeys("housing");
        assertThat(totals.getAllowances().get("housing")).isEqualByComparingTo("150.00");
        assertThat(totals.getOtherDeductions()).isEqualByComparingTo("25.00");
    }

    @Test
    @DisplayName("A monthly allowance dated in November counts once in the following January")
    void recurringAllowanceAcrossYears() {
        EmployeeEvent allowance = event(EventType.ALLOWANCE, "Transport", "150.00", LocalDate.of(2023, 11, 15));
        allowance.setRecurrenceType(RecurrenceType.MONTHLY);

        List<Occurrence> occurrences = EventAggregator.expand(List.of(allowance),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        EventTotals totals = EventAggregator.totals(occurrences, ScenarioToggles.allEnabled());

        assertThat(occurrences).extracting(Occurrence::getDate).containsExactly(LocalDate.of(2024, 1, 15));
        assertThat(totals.getAllowances().get("transport")).isEqualByComparingTo("150.00");
        assertThat(totals.getOccurrenceCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Cancelled and non-payroll events produce no occurrences")
    void skipsInactiveEvents() {
        EmployeeEvent cancelled = event(EventType.BONUS, "Bonus", "100", LocalDate.of(2024, 3, 2));
        cancelled.setStatus(EventStatus.CANCELLED);
        EmployeeEvent informational = event(EventType.OTHER, "Training", "0", LocalDate.of(2024, 3, 3));
        informational.setAffectsPayroll(false);

        assertThat(EventAggregator.expand(List.of(cancelled, informational), START, END)).isEmpty();
    }

    @Test
    @DisplayName("Switched-off categories come back as null rather than zero")
    void disabledCategoriesAreNull() {
        List<Occurrence> occurrences = EventAggregator.expand(List.of(
                event(EventType.BONUS, "Bonus", "100", LocalDate.of(2024, 3, 2)),
                event(EventType.DEDUCTION, "Uniform", "30", LocalDate.of(2024, 3, 4))), START, END);
        ScenarioToggles toggles = ScenarioToggles.builder()
                .bonuses(false)
                .allowances(false)
                .deductions(false)
                .build();

        EventTotals totals = EventAggregator.totals(occurrences, toggles);

        assertThat(totals.getBonusAmount()).isNull();
        assertThat(totals.getAllowances()).isNull();
        assertThat(totals.getOtherDeductions()).isNull();
        assertThat(totals.getOccurrenceCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Allowance keys are derived from the title")
    void allowanceKeys() {
        assertThat(EventAggregator.allowanceKey("Housing Allowance")).isEqualTo("housing");
        assertThat(EventAggregator.allowanceKey("Car & Fuel")).isEqualTo("car_fuel");
        assertThat(EventAggregator.allowanceKey("  ")).isEqualTo("allowance");
        assertThat(EventAggregator.allowanceKey(null)).isEqualTo("allowance");
    }
}

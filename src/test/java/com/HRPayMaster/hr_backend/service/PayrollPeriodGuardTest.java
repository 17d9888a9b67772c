package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.PayrollRun;
import com.HRPayMaster.hr_backend.model.PayrollRunDay;
import com.HRPayMaster.hr_backend.repository.PayrollRunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PayrollPeriodGuard")
class PayrollPeriodGuardTest {

    @Mock
    private PayrollRunRepository payrollRunRepository;

    @InjectMocks
    private PayrollPeriodGuard guard;

    @Test
    @DisplayName("Missing fields are reported together")
    void missingFieldsReported() {
        assertThatThrownBy(() -> guard.validate(" ", null, null))
                .isInstanceOfSatisfying(ValidationException.class, ex ->
                        assertThat(ex.getFieldErrors()).extracting("field")
                                .containsExactly("period", "startDate", "endDate"));
    }

    @Test
    @DisplayName("An end date before the start date is invalid")
    void invertedPeriodRejected() {
        assertThatThrownBy(() -> guard.validate("2024-02", LocalDate.of(2024, 2, 29), LocalDate.of(2024, 2, 1)))
                .isInstanceOf(ValidationException.class);
        assertThatCode(() -> guard.validate("2024-02", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 1)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("An overlapping run is reported as a conflict naming that run")
    void overlapIsConflict() {
        LocalDate start = LocalDate.of(2024, 2, 15);
        LocalDate end = LocalDate.of(2024, 3, 14);
        PayrollRun existing = PayrollRun.builder()
                .id(UUID.randomUUID())
                .period("2024-02")
                .startDate(LocalDate.of(2024, 2, 1))
                .endDate(LocalDate.of(2024, 2, 29))
                .build();
        when(payrollRunRepository.findOverlapping(start, end)).thenReturn(List.of(existing));

        assertThatThrownBy(() -> guard.checkNoOverlap(start, end))
                .isInstanceOfSatisfying(ConflictException.class, ex -> {
                    assertThat(ex.getConflictingResource()).isEqualTo("payroll_run");
                    assertThat(ex.getConflictingId()).isEqualTo(existing.getId());
                });
    }

    @Test
    @DisplayName("Day locks cover every day of the period")
    void dayLocksCoverPeriod() {
        UUID runId = UUID.randomUUID();

        List<PayrollRunDay> days = guard.dayLocks(runId, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));

        assertThat(days).hasSize(29);
        assertThat(days.get(0).getDay()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(days.get(28).getDay()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(days).allMatch(day -> runId.equals(day.getPayrollRunId()));
    }
}

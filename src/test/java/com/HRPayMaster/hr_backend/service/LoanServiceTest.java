package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.config.PayrollProperties;
import com.HRPayMaster.hr_backend.dto.request.LoanPaymentRequest;
import com.HRPayMaster.hr_backend.dto.request.LoanRequest;
import com.HRPayMaster.hr_backend.dto.response.AmortizationScheduleResponse;
import com.HRPayMaster.hr_backend.dto.response.AmortizationScheduleResponse.Installment;
import com.HRPayMaster.hr_backend.dto.response.LoanResponse;
import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.LoanPaymentRepository;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoanService")
class LoanServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Mock
    private LoanRepository loanRepository;
    @Mock
    private LoanPaymentRepository loanPaymentRepository;
    @Mock
    private EmployeeRepository employeeRepository;
    @Mock
    private LoanDeductionScheduler loanDeductionScheduler;

    private LoanService loanService;
    private Employee employee;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-10T00:00:00Z"), ZoneOffset.UTC);
        loanService = new LoanService(loanRepository, loanPaymentRepository, employeeRepository,
                loanDeductionScheduler, new PayrollProperties(), clock);
        employee = Employee.builder()
                .id(UUID.randomUUID())
                .firstName("Yousef")
                .salary(new BigDecimal("1000.00"))
                .build();
    }

    private LoanRequest loanRequest(String monthlyDeduction) {
        LoanRequest request = new LoanRequest();
        request.setEmployeeId(employee.getId());
        request.setAmount(new BigDecimal("2000.00"));
        request.setMonthlyDeduction(new BigDecimal(monthlyDeduction));
        request.setStartDate(START);
        return request;
    }

    @Test
    @DisplayName("Interest-free loan is repaid in equal installments with a smaller last one")
    void interestFreeSchedule() {
        AmortizationScheduleResponse schedule = LoanService.amortizationSchedule(
                new BigDecimal("1000"), new BigDecimal("300"), BigDecimal.ZERO, START, null);

        assertThat(schedule.getInstallments()).extracting(Installment::getPaymentAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("300"), new BigDecimal("300"), new BigDecimal("300"), new BigDecimal("100"));
        assertThat(schedule.getTotalInterest()).isEqualByComparingTo("0");
        assertThat(schedule.getTotalPaid()).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("Interest is charged on the opening balance of each month")
    void interestBearingSchedule() {
        AmortizationScheduleResponse schedule = LoanService.amortizationSchedule(
                new BigDecimal("1000"), new BigDecimal("100"), new BigDecimal("12"), START, null);

        Installment first = schedule.getInstallments().get(0);
        Installment last = schedule.getInstallments().get(schedule.getInstallments().size() - 1);
        assertThat(first.getInterestAmount()).isEqualByComparingTo("10.00");
        assertThat(first.getPrincipalAmount()).isEqualByComparingTo("90.00");
        assertThat(last.getClosingBalance()).isEqualByComparingTo("0");
        assertThat(schedule.getTotalPaid()).isEqualByComparingTo(
                schedule.getPrincipal().add(schedule.getTotalInterest()));
    }

    @Test
    @DisplayName("A hard end date closes the schedule with a balloon installment")
    void balloonAfterEndDate() {
        AmortizationScheduleResponse schedule = LoanService.amortizationSchedule(
                new BigDecimal("1000"), new BigDecimal("100"), BigDecimal.ZERO, START, LocalDate.of(2024, 3, 1));

        assertThat(schedule.getInstallments()).hasSize(4);
        Installment balloon = schedule.getInstallments().get(3);
        assertThat(balloon.getDueDate()).isEqualTo(LocalDate.of(2024, 4, 1));
        assertThat(balloon.getPrincipalAmount()).isEqualByComparingTo("700.00");
    }

    @Test
    @DisplayName("A payment that only covers interest is rejected")
    void paymentBelowInterest() {
        assertThatThrownBy(() -> LoanService.amortizationSchedule(
                new BigDecimal("1000"), new BigDecimal("10"), new BigDecimal("12"), START, null))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    @DisplayName("A deduction above the soft share of salary creates the loan with a warning")
    void softLimitWarns() {
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(loanRepository.save(any(Loan.class))).thenAnswer(invocation -> invocation.getArgument(0));

        LoanResponse response = loanService.createLoan(loanRequest("400.00"));

        assertThat(response.getStatus()).isEqualTo(LoanStatus.PENDING);
        assertThat(response.getRemainingAmount()).isEqualByComparingTo("2000.00");
        assertThat(response.getWarnings()).singleElement().asString().contains("35%");
    }

    @Test
    @DisplayName("A deduction above the hard share of salary is refused")
    void hardLimitRefuses() {
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));

        assertThatThrownBy(() -> loanService.createLoan(loanRequest("600.00")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("50%");
        verify(loanRepository, never()).save(any());
    }

    @Test
    @DisplayName("Manual payments are refused on pending loans")
    void manualPaymentOnPendingLoan() {
        Loan loan = Loan.builder()
                .id(UUID.randomUUID())
                .employee(employee)
                .amount(new BigDecimal("500.00"))
                .monthlyDeduction(new BigDecimal("100.00"))
                .remainingAmount(new BigDecimal("500.00"))
                .status(LoanStatus.PENDING)
                .build();
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        LoanPaymentRequest payment = new LoanPaymentRequest();
        payment.setAmount(new BigDecimal("100.00"));

        assertThatThrownBy(() -> loanService.recordManualPayment(loan.getId(), payment))
                .isInstanceOf(ConflictException.class);
        verifyNoInteractions(loanDeductionScheduler);
    }

    @Test
    @DisplayName("Manual payments go through the shared deduction path dated today")
    void manualPaymentUsesScheduler() {
        Loan loan = Loan.builder()
                .id(UUID.randomUUID())
                .employee(employee)
                .amount(new BigDecimal("500.00"))
                .monthlyDeduction(new BigDecimal("100.00"))
                .remainingAmount(new BigDecimal("500.00"))
                .status(LoanStatus.PAUSED)
                .build();
        when(loanRepository.findById(loan.getId())).thenReturn(Optional.of(loan));
        when(loanDeductionScheduler.applyDeduction(any(), any(), any(), any(), any(), any())).thenReturn(loan);
        LoanPaymentRequest payment = new LoanPaymentRequest();
        payment.setAmount(new BigDecimal("150"));

        loanService.recordManualPayment(loan.getId(), payment);

        verify(loanDeductionScheduler).applyDeduction(loan, new BigDecimal("150.00"), null,
                LocalDate.of(2024, 1, 10), "manual", null);
    }
}

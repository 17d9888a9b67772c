package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.model.LoanPayment;
import com.HRPayMaster.hr_backend.repository.LoanPaymentRepository;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import com.HRPayMaster.hr_backend.service.LoanDeductionScheduler.LoanAllocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoanDeductionScheduler")
class LoanDeductionSchedulerTest {

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private LoanPaymentRepository loanPaymentRepository;

    @InjectMocks
    private LoanDeductionScheduler scheduler;

    private static Loan loan(String monthly, String remaining, LoanStatus status) {
        return Loan.builder()
                .id(UUID.randomUUID())
                .employee(Employee.builder().id(UUID.randomUUID()).firstName("Sara").build())
                .amount(new BigDecimal("1000.00"))
                .monthlyDeduction(new BigDecimal(monthly))
                .remainingAmount(new BigDecimal(remaining))
                .startDate(LocalDate.of(2024, 1, 1))
                .status(status)
                .build();
    }

    @Test
    @DisplayName("Installment is the monthly deduction, capped at the remaining balance")
    void installmentCappedAtRemaining() {
        assertThat(LoanDeductionScheduler.installment(loan("200.00", "500.00", LoanStatus.ACTIVE)))
                .isEqualByComparingTo("200.00");
        assertThat(LoanDeductionScheduler.installment(loan("200.00", "120.00", LoanStatus.ACTIVE)))
                .isEqualByComparingTo("120.00");
        assertThat(LoanDeductionScheduler.installment(loan("200.00", "500.00", LoanStatus.PAUSED)))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Plan skips loans with nothing to deduct")
    void planSkipsEmptyInstallments() {
        UUID employeeId = UUID.randomUUID();
        Loan active = loan("150.00", "400.00", LoanStatus.ACTIVE);
        Loan settled = loan("150.00", "0.00", LoanStatus.ACTIVE);
        when(loanRepository.findDeductibleLoans(employeeId)).thenReturn(List.of(active, settled));

        List<LoanAllocation> plan = scheduler.plan(employeeId);

        assertThat(plan).extracting(LoanAllocation::getLoanId).containsExactly(active.getId());
        assertThat(LoanDeductionScheduler.total(plan)).isEqualByComparingTo("150.00");
    }

    @Test
    @DisplayName("Cap trims allocations in order so the later loans absorb the shortfall")
    void capTrimsInOrder() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        List<LoanAllocation> capped = LoanDeductionScheduler.cap(List.of(
                new LoanAllocation(first, new BigDecimal("300.00")),
                new LoanAllocation(second, new BigDecimal("200.00"))), new BigDecimal("350.00"));

        assertThat(capped).hasSize(2);
        assertThat(capped.get(0).getAmount()).isEqualByComparingTo("300.00");
        assertThat(capped.get(1).getAmount()).isEqualByComparingTo("50.00");
        assertThat(LoanDeductionScheduler.cap(capped, new BigDecimal("-5"))).isEmpty();
    }

    @Test
    @DisplayName("A deduction that clears the balance completes the loan and records a payment")
    void finalDeductionCompletesLoan() {
        Loan loan = loan("200.00", "150.00", LoanStatus.ACTIVE);
        when(loanRepository.save(any(Loan.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Loan saved = scheduler.applyDeduction(loan, new BigDecimal("150.00"), null,
                LocalDate.of(2024, 2, 29), "payroll", null);

        assertThat(saved.getRemainingAmount()).isEqualByComparingTo("0");
        assertThat(saved.getStatus()).isEqualTo(LoanStatus.COMPLETED);
        ArgumentCaptor<LoanPayment> payment = ArgumentCaptor.forClass(LoanPayment.class);
        verify(loanPaymentRepository).save(payment.capture());
        assertThat(payment.getValue().getAmount()).isEqualByComparingTo("150.00");
        assertThat(payment.getValue().getSource()).isEqualTo("payroll");
    }

    @Test
    @DisplayName("A deduction larger than the remaining balance is refused")
    void overDeductionRefused() {
        Loan loan = loan("200.00", "100.00", LoanStatus.ACTIVE);

        assertThatThrownBy(() -> scheduler.applyDeduction(loan, new BigDecimal("100.01"), null,
                LocalDate.of(2024, 2, 29), "manual", null))
                .isInstanceOf(ComputationException.class);
        verify(loanRepository, never()).save(any());
        verify(loanPaymentRepository, never()).save(any());
    }
}

package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.enums.LedgerEntryType;
import com.HRPayMaster.hr_backend.exception.InsufficientLeaveBalanceException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("LeaveAccrualService")
class LeaveAccrualServiceTest {

    @Nested
    @DisplayName("Accrual arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Accrual dates fall one month apart after the start, within the year")
        void accrualDates() {
            assertThat(LeaveAccrualService.accrualDates(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 5, 1), 2024))
                    .containsExactly(LocalDate.of(2024, 2, 15), LocalDate.of(2024, 3, 15), LocalDate.of(2024, 4, 15));
            assertThat(LeaveAccrualService.accrualDates(LocalDate.of(2023, 11, 10), LocalDate.of(2024, 3, 20), 2024))
                    .containsExactly(LocalDate.of(2024, 1, 10), LocalDate.of(2024, 2, 10), LocalDate.of(2024, 3, 10));
            assertThat(LeaveAccrualService.accrualDates(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 30), 2024))
                    .isEmpty();
        }

        @Test
        @DisplayName("Accrual stops at the maximum balance")
        void cappedAccrual() {
            assertThat(LeaveAccrualService.cappedAccrual(new BigDecimal("2.5"), new BigDecimal("19"), new BigDecimal("20")))
                    .isEqualByComparingTo("1.00");
            assertThat(LeaveAccrualService.cappedAccrual(new BigDecimal("2.5"), new BigDecimal("21"), new BigDecimal("20")))
                    .isEqualByComparingTo("0.00");
            assertThat(LeaveAccrualService.cappedAccrual(new BigDecimal("2.5"), new BigDecimal("40"), null))
                    .isEqualByComparingTo("2.50");
        }

        @Test
        @DisplayName("Carryover is limited, except for negative balances or no limit")
        void carryover() {
            assertThat(LeaveAccrualService.carryover(new BigDecimal("12"), new BigDecimal("5"))).isEqualByComparingTo("5");
            assertThat(LeaveAccrualService.carryover(new BigDecimal("-3"), new BigDecimal("5"))).isEqualByComparingTo("-3");
            assertThat(LeaveAccrualService.carryover(new BigDecimal("8"), null)).isEqualByComparingTo("8");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Consumption")
    class Consumption {

        @Mock
        private LeaveAccrualPolicyRepository policyRepository;
        @Mock
        private EmployeeLeavePolicyRepository assignmentRepository;
        @Mock
        private LeaveBalanceRepository leaveBalanceRepository;
        @Mock
        private LeaveAccrualLedgerRepository ledgerRepository;
        @Mock
        private EmployeeRepository employeeRepository;

        private LeaveAccrualService service;
        private Employee employee;
        private LeaveAccrualPolicy policy;

        @BeforeEach
        void setUp() {
            Clock clock = Clock.fixed(Instant.parse("2024-04-20T10:00:00Z"), ZoneOffset.UTC);
            service = new LeaveAccrualService(policyRepository, assignmentRepository, leaveBalanceRepository,
                    ledgerRepository, employeeRepository, clock);
            employee = Employee.builder().id(UUID.randomUUID()).firstName("Huda").build();
            policy = LeaveAccrualPolicy.builder()
                    .id(UUID.randomUUID())
                    .name("Annual")
                    .leaveType("annual")
                    .accrualRatePerMonth(new BigDecimal("2.00"))
                    .effectiveFrom(LocalDate.of(2023, 1, 1))
                    .build();
        }

        private void assignPolicy() {
            EmployeeLeavePolicy assignment = EmployeeLeavePolicy.builder()
                    .id(UUID.randomUUID())
                    .employee(employee)
                    .policy(policy)
                    .effectiveFrom(LocalDate.of(2024, 1, 1))
                    .build();
            when(assignmentRepository.findAssignments(employee.getId(), "annual")).thenReturn(List.of(assignment));
            when(leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIgnoreCaseAndYear(any(), anyString(), anyInt()))
                    .thenReturn(Optional.empty());
            when(leaveBalanceRepository.save(any(LeaveBalance.class))).thenAnswer(invocation -> invocation.getArgument(0));
        }

        private VacationRequest request(int days) {
            return VacationRequest.builder()
                    .id(UUID.randomUUID())
                    .employee(employee)
                    .leaveType("Annual")
                    .startDate(LocalDate.of(2024, 5, 6))
                    .endDate(LocalDate.of(2024, 5, 5 + days))
                    .days(days)
                    .build();
        }

        @Test
        @DisplayName("Three monthly accruals cover a four-day request and the ledger records the consumption")
        void consumesAccruedDays() {
            assignPolicy();

            BigDecimal consumed = service.consume(request(4));

            assertThat(consumed).isEqualByComparingTo("4.00");
            ArgumentCaptor<LeaveAccrualLedgerEntry> lines = ArgumentCaptor.forClass(LeaveAccrualLedgerEntry.class);
            verify(ledgerRepository, atLeastOnce()).save(lines.capture());
            assertThat(lines.getAllValues()).extracting(LeaveAccrualLedgerEntry::getEntryType)
                    .containsExactly(LedgerEntryType.ACCRUAL, LedgerEntryType.ACCRUAL, LedgerEntryType.ACCRUAL,
                            LedgerEntryType.CONSUMPTION);
            LeaveAccrualLedgerEntry consumption = lines.getAllValues().get(3);
            assertThat(consumption.getAmount()).isEqualByComparingTo("-4.00");
            assertThat(consumption.getSourceKey()).startsWith("vacation:");
        }

        @Test
        @DisplayName("A request larger than the balance is refused when the policy forbids going negative")
        void insufficientBalance() {
            assignPolicy();

            assertThatThrownBy(() -> service.consume(request(7)))
                    .isInstanceOf(InsufficientLeaveBalanceException.class)
                    .hasMessageContaining("Available: 6.00");
        }

        @Test
        @DisplayName("A policy that allows negative balances lets the request through")
        void negativeAllowed() {
            policy.setAllowNegativeBalance(true);
            assignPolicy();

            assertThat(service.consume(request(7))).isEqualByComparingTo("7.00");
        }

        @Test
        @DisplayName("Untracked leave types consume nothing")
        void untrackedLeaveType() {
            when(assignmentRepository.findAssignments(employee.getId(), "annual")).thenReturn(List.of());

            assertThat(service.consume(request(3))).isEqualByComparingTo("0");
            verifyNoInteractions(leaveBalanceRepository, ledgerRepository);
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Year boundary")
    class YearBoundary {

        @Mock
        private LeaveAccrualPolicyRepository policyRepository;
        @Mock
        private EmployeeLeavePolicyRepository assignmentRepository;
        @Mock
        private LeaveBalanceRepository leaveBalanceRepository;
        @Mock
        private LeaveAccrualLedgerRepository ledgerRepository;
        @Mock
        private EmployeeRepository employeeRepository;

        private final Map<Integer, LeaveBalance> balances = new HashMap<>();
        private final List<LeaveAccrualLedgerEntry> ledger = new ArrayList<>();

        private LeaveAccrualService service;
        private Employee employee;
        private LeaveAccrualPolicy policy;

        @BeforeEach
        void setUp() {
            Clock clock = Clock.fixed(Instant.parse("2026-01-10T09:00:00Z"), ZoneOffset.UTC);
            service = new LeaveAccrualService(policyRepository, assignmentRepository, leaveBalanceRepository,
                    ledgerRepository, employeeRepository, clock);
            employee = Employee.builder().id(UUID.randomUUID()).firstName("Mariam").build();
            policy = LeaveAccrualPolicy.builder()
                    .id(UUID.randomUUID())
                    .name("Annual")
                    .leaveType("annual")
                    .accrualRatePerMonth(new BigDecimal("2.00"))
                    .effectiveFrom(LocalDate.of(2025, 1, 1))
                    .build();
        }

        /**
         * Balances and ledger lines live in memory so repeated syncs see what earlier ones wrote.
         */
        private void storeInMemory() {
            EmployeeLeavePolicy assignment = EmployeeLeavePolicy.builder()
                    .id(UUID.randomUUID())
                    .employee(employee)
                    .policy(policy)
                    .effectiveFrom(LocalDate.of(2025, 1, 1))
                    .build();
            when(assignmentRepository.findAssignments(employee.getId(), "annual")).thenReturn(List.of(assignment));
            when(leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIgnoreCaseAndYear(eq(employee.getId()),
                    eq("annual"), anyInt()))
                    .thenAnswer(invocation -> Optional.ofNullable(balances.get(invocation.<Integer>getArgument(2))));
            when(leaveBalanceRepository.save(any(LeaveBalance.class))).thenAnswer(invocation -> {
                LeaveBalance balance = invocation.getArgument(0);
                balances.put(balance.getYear(), balance);
                return balance;
            });
            when(ledgerRepository.existsByEmployeeIdAndLeaveTypeAndEntryTypeAndEntryDateAndSourceKey(
                    any(), anyString(), any(), any(), anyString()))
                    .thenAnswer(invocation -> ledger.stream().anyMatch(line ->
                            line.getLeaveType().equals(invocation.getArgument(1))
                                    && line.getEntryType() == invocation.getArgument(2)
                                    && line.getEntryDate().equals(invocation.getArgument(3))
                                    && line.getSourceKey().equals(invocation.getArgument(4))));
            when(ledgerRepository.save(any(LeaveAccrualLedgerEntry.class))).thenAnswer(invocation -> {
                LeaveAccrualLedgerEntry line = invocation.getArgument(0);
                ledger.add(line);
                return line;
            });
        }

        private VacationRequest decemberLeave() {
            return VacationRequest.builder()
                    .id(UUID.randomUUID())
                    .employee(employee)
                    .leaveType("Annual")
                    .startDate(LocalDate.of(2025, 12, 20))
                    .endDate(LocalDate.of(2025, 12, 24))
                    .days(5)
                    .build();
        }

        private List<LeaveAccrualLedgerEntry> lines(LedgerEntryType type, LocalDate date) {
            return ledger.stream()
                    .filter(line -> line.getEntryType() == type && line.getEntryDate().equals(date))
                    .collect(Collectors.toList());
        }

        @Test
        @DisplayName("The new year opens with last year's closing balance plus its first accrual")
        void opensNewYear() {
            storeInMemory();

            LeaveBalance opened = service.syncBalance(employee, "annual", 2026);

            assertThat(balances.get(2025).getBalanceDays()).isEqualByComparingTo("22.00");
            assertThat(opened.getCarriedOverDays()).isEqualByComparingTo("22.00");
            assertThat(opened.getBalanceDays()).isEqualByComparingTo("24.00");
            assertThat(lines(LedgerEntryType.CARRYOVER, LocalDate.of(2026, 1, 1)))
                    .extracting(LeaveAccrualLedgerEntry::getAmount)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("22.00"));
        }

        @Test
        @DisplayName("Leave approved for the closed year also comes off the balance already carried forward")
        void consumptionInClosedYearReachesOpenYear() {
            storeInMemory();
            service.syncBalance(employee, "annual", 2026);

            service.consume(decemberLeave());

            assertThat(balances.get(2025).getBalanceDays()).isEqualByComparingTo("17.00");
            assertThat(balances.get(2026).getCarriedOverDays()).isEqualByComparingTo("17.00");
            assertThat(balances.get(2026).getBalanceDays()).isEqualByComparingTo("19.00");
            assertThat(lines(LedgerEntryType.CARRYOVER, LocalDate.of(2026, 1, 1)))
                    .extracting(LeaveAccrualLedgerEntry::getAmount)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("22.00"), new BigDecimal("-5.00"));
        }

        @Test
        @DisplayName("A carryover limit forfeits the excess, and later consumption shrinks the forfeit first")
        void cappedCarryoverAdjustsForfeit() {
            policy.setCarryoverLimitDays(new BigDecimal("20.00"));
            storeInMemory();

            LeaveBalance opened = service.syncBalance(employee, "annual", 2026);

            assertThat(opened.getCarriedOverDays()).isEqualByComparingTo("20.00");
            assertThat(opened.getBalanceDays()).isEqualByComparingTo("22.00");
            assertThat(lines(LedgerEntryType.CARRYOVER_FORFEIT, LocalDate.of(2026, 1, 1)))
                    .extracting(LeaveAccrualLedgerEntry::getAmount)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("-2.00"));

            service.consume(decemberLeave());

            assertThat(balances.get(2026).getCarriedOverDays()).isEqualByComparingTo("17.00");
            assertThat(balances.get(2026).getBalanceDays()).isEqualByComparingTo("19.00");
            assertThat(lines(LedgerEntryType.CARRYOVER, LocalDate.of(2026, 1, 1)))
                    .extracting(LeaveAccrualLedgerEntry::getAmount)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("20.00"), new BigDecimal("-3.00"));
            assertThat(lines(LedgerEntryType.CARRYOVER_FORFEIT, LocalDate.of(2026, 1, 1)))
                    .extracting(LeaveAccrualLedgerEntry::getAmount)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("-2.00"), new BigDecimal("2.00"));
        }

        @Test
        @DisplayName("Cancelling closed-year leave gives the days back in the open year too")
        void restoreInClosedYearReachesOpenYear() {
            policy.setCarryoverLimitDays(new BigDecimal("20.00"));
            storeInMemory();
            service.syncBalance(employee, "annual", 2026);
            VacationRequest request = decemberLeave();
            request.setConsumedDays(service.consume(request));

            service.restore(request);

            assertThat(balances.get(2025).getBalanceDays()).isEqualByComparingTo("22.00");
            assertThat(balances.get(2026).getCarriedOverDays()).isEqualByComparingTo("20.00");
            assertThat(balances.get(2026).getBalanceDays()).isEqualByComparingTo("22.00");
            assertThat(ledger).filteredOn(line -> line.getEntryType() == LedgerEntryType.CARRYOVER
                            || line.getEntryType() == LedgerEntryType.CARRYOVER_FORFEIT)
                    .extracting(LeaveAccrualLedgerEntry::getAmount)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("20"), new BigDecimal("-2"), new BigDecimal("-3"),
                            new BigDecimal("2"), new BigDecimal("3"), new BigDecimal("-2"));
        }

        @Test
        @DisplayName("Consuming in a year whose successor is not yet open leaves nothing to adjust")
        void noSuccessorYet() {
            storeInMemory();

            service.consume(decemberLeave());

            assertThat(balances).containsOnlyKeys(2025);
            assertThat(balances.get(2025).getBalanceDays()).isEqualByComparingTo("17.00");

            LeaveBalance opened = service.syncBalance(employee, "annual", 2026);
            assertThat(opened.getBalanceDays()).isEqualByComparingTo("19.00");
        }
    }
}

package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.VacationApprovalActionRequest;
import com.HRPayMaster.hr_backend.dto.request.VacationRequestCreateRequest;
import com.HRPayMaster.hr_backend.dto.request.VacationTransitionRequest;
import com.HRPayMaster.hr_backend.dto.response.VacationResponse;
import com.HRPayMaster.hr_backend.enums.ApprovalAction;
import com.HRPayMaster.hr_backend.enums.ApprovalStepStatus;
import com.HRPayMaster.hr_backend.enums.AuditAction;
import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.exception.AuthorizationException;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.model.VacationApprovalStep;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.LeaveAccrualPolicyRepository;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import com.HRPayMaster.hr_backend.repository.VacationRequestRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VacationService")
class VacationServiceTest {

    @Mock
    private VacationRequestRepository vacationRequestRepository;
    @Mock
    private EmployeeRepository employeeRepository;
    @Mock
    private LeaveAccrualPolicyRepository leaveAccrualPolicyRepository;
    @Mock
    private LoanRepository loanRepository;
    @Mock
    private LeaveAccrualService leaveAccrualService;
    @Mock
    private CoverageService coverageService;

    private VacationService vacationService;

    private final UUID firstApprover = UUID.randomUUID();
    private final UUID secondApprover = UUID.randomUUID();
    private Employee employee;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
        vacationService = new VacationService(vacationRequestRepository, employeeRepository,
                leaveAccrualPolicyRepository, loanRepository, leaveAccrualService, coverageService, clock);
        employee = Employee.builder()
                .id(UUID.randomUUID())
                .employeeCode("EMP-12")
                .firstName("Fatima")
                .lastName("Ali")
                .salary(new BigDecimal("2000.00"))
                .status(EmployeeStatus.ACTIVE)
                .build();
    }

    private VacationRequest pendingRequest(UUID... approvers) {
        List<VacationApprovalStep> chain = new ArrayList<>();
        for (UUID approver : approvers) {
            chain.add(VacationApprovalStep.builder().approverId(approver).build());
        }
        return VacationRequest.builder()
                .id(UUID.randomUUID())
                .employee(employee)
                .leaveType("annual")
                .startDate(LocalDate.of(2024, 6, 3))
                .endDate(LocalDate.of(2024, 6, 7))
                .days(5)
                .approvalChain(chain)
                .build();
    }

    private void stubLookup(VacationRequest vacation) {
        when(vacationRequestRepository.findById(vacation.getId())).thenReturn(Optional.of(vacation));
    }

    private void stubSave() {
        when(vacationRequestRepository.saveAndFlush(any(VacationRequest.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static VacationApprovalActionRequest action(UUID actor, ApprovalAction action) {
        return VacationApprovalActionRequest.builder()
                .actingApproverId(actor)
                .action(action)
                .build();
    }

    @Test
    @DisplayName("Submitting builds a pending chain with one step per approver")
    void submitBuildsChain() {
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(coverageService.findOverlappingRequests(any(), any(), any())).thenReturn(List.of());
        when(vacationRequestRepository.save(any(VacationRequest.class))).thenAnswer(invocation -> invocation.getArgument(0));

        VacationResponse response = vacationService.submitVacation(VacationRequestCreateRequest.builder()
                .employeeId(employee.getId())
                .leaveType(" Annual ")
                .startDate(LocalDate.of(2024, 6, 3))
                .endDate(LocalDate.of(2024, 6, 7))
                .approverIds(List.of(firstApprover, secondApprover))
                .build());

        assertThat(response.getStatus()).isEqualTo(VacationStatus.PENDING);
        assertThat(response.getLeaveType()).isEqualTo("annual");
        assertThat(response.getDays()).isEqualTo(5);
        assertThat(response.getApprovalChain()).hasSize(2)
                .allMatch(step -> step.getStatus() == ApprovalStepStatus.PENDING);
        assertThat(response.isMarkEmployeeOnLeave()).isTrue();
        assertThat(response.isPauseLoans()).isFalse();
        assertThat(response.getAuditLog()).singleElement()
                .satisfies(entry -> assertThat(entry.getAction()).isEqualTo(AuditAction.CREATED));
    }

    @Test
    @DisplayName("A request overlapping an existing one is a conflict")
    void submitOverlapConflict() {
        VacationRequest existing = pendingRequest(firstApprover);
        existing.setStatus(VacationStatus.APPROVED);
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(coverageService.findOverlappingRequests(any(), any(), any())).thenReturn(List.of(existing));

        assertThatThrownBy(() -> vacationService.submitVacation(VacationRequestCreateRequest.builder()
                .employeeId(employee.getId())
                .leaveType("annual")
                .startDate(LocalDate.of(2024, 6, 5))
                .endDate(LocalDate.of(2024, 6, 10))
                .approverIds(List.of(firstApprover))
                .build()))
                .isInstanceOfSatisfying(ConflictException.class,
                        ex -> assertThat(ex.getConflictingId()).isEqualTo(existing.getId()));
        verify(vacationRequestRepository, never()).save(any());
    }

    @Test
    @DisplayName("Two approvals walk the chain and the last one approves the request")
    void twoStepApproval() {
        VacationRequest vacation = pendingRequest(firstApprover, secondApprover);
        stubLookup(vacation);
        stubSave();
        when(leaveAccrualService.consume(vacation)).thenReturn(new BigDecimal("5.00"));

        VacationResponse afterFirst = vacationService.actOnApproval(vacation.getId(),
                action(firstApprover, ApprovalAction.APPROVE));
        assertThat(afterFirst.getStatus()).isEqualTo(VacationStatus.PENDING);
        assertThat(afterFirst.getCurrentStepIndex()).isEqualTo(1);
        verifyNoInteractions(leaveAccrualService);

        VacationResponse afterSecond = vacationService.actOnApproval(vacation.getId(),
                action(secondApprover, ApprovalAction.APPROVE));

        assertThat(afterSecond.getStatus()).isEqualTo(VacationStatus.APPROVED);
        assertThat(afterSecond.getConsumedDays()).isEqualByComparingTo("5.00");
        assertThat(employee.getStatus()).isEqualTo(EmployeeStatus.ON_LEAVE);
        verify(employeeRepository).save(employee);
    }

    @Test
    @DisplayName("A rejection at the first step ends the request without touching later steps")
    void rejectShortCircuits() {
        VacationRequest vacation = pendingRequest(firstApprover, secondApprover);
        stubLookup(vacation);
        stubSave();

        VacationResponse response = vacationService.actOnApproval(vacation.getId(),
                action(firstApprover, ApprovalAction.REJECT));

        assertThat(response.getStatus()).isEqualTo(VacationStatus.REJECTED);
        assertThat(response.getApprovalChain().get(1).getStatus()).isEqualTo(ApprovalStepStatus.PENDING);
        assertThatThrownBy(() -> vacationService.actOnApproval(vacation.getId(),
                action(secondApprover, ApprovalAction.APPROVE)))
                .isInstanceOf(ConflictException.class);
        verifyNoInteractions(leaveAccrualService);
    }

    @Test
    @DisplayName("An approver who is not on the current step is refused and nothing changes")
    void wrongApproverRefused() {
        VacationRequest vacation = pendingRequest(firstApprover, secondApprover);
        stubLookup(vacation);

        assertThatThrownBy(() -> vacationService.actOnApproval(vacation.getId(),
                action(secondApprover, ApprovalAction.APPROVE)))
                .isInstanceOf(AuthorizationException.class);

        assertThat(vacation.getCurrentStepIndex()).isZero();
        assertThat(vacation.getApprovalChain().get(0).getStatus()).isEqualTo(ApprovalStepStatus.PENDING);
        assertThat(vacation.getAuditLog()).isEmpty();
        verify(vacationRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("A delegate can act on the step it was handed")
    void delegateThenApprove() {
        UUID delegate = UUID.randomUUID();
        VacationRequest vacation = pendingRequest(firstApprover);
        vacation.setMarkEmployeeOnLeave(false);
        stubLookup(vacation);
        stubSave();
        when(leaveAccrualService.consume(vacation)).thenReturn(BigDecimal.ZERO);

        VacationApprovalActionRequest delegation = action(firstApprover, ApprovalAction.DELEGATE);
        delegation.setDelegateToId(delegate);
        VacationResponse delegated = vacationService.actOnApproval(vacation.getId(), delegation);
        assertThat(delegated.getStatus()).isEqualTo(VacationStatus.PENDING);
        assertThat(delegated.getApprovalChain().get(0).getDelegatedToId()).isEqualTo(delegate);

        VacationResponse approved = vacationService.actOnApproval(vacation.getId(), action(delegate, ApprovalAction.APPROVE));

        assertThat(approved.getStatus()).isEqualTo(VacationStatus.APPROVED);
        assertThat(employee.getStatus()).isEqualTo(EmployeeStatus.ACTIVE);
    }

    @Test
    @DisplayName("Delegating to yourself is invalid")
    void selfDelegationInvalid() {
        VacationRequest vacation = pendingRequest(firstApprover);
        stubLookup(vacation);
        VacationApprovalActionRequest delegation = action(firstApprover, ApprovalAction.DELEGATE);
        delegation.setDelegateToId(firstApprover);

        assertThatThrownBy(() -> vacationService.actOnApproval(vacation.getId(), delegation))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Approval with loan pausing pauses active loans and cancelling resumes them")
    void pauseAndResumeLoans() {
        VacationRequest vacation = pendingRequest(firstApprover);
        vacation.setPauseLoans(true);
        Loan loan = Loan.builder()
                .id(UUID.randomUUID())
                .employee(employee)
                .monthlyDeduction(new BigDecimal("100.00"))
                .remainingAmount(new BigDecimal("500.00"))
                .status(LoanStatus.ACTIVE)
                .build();
        stubLookup(vacation);
        stubSave();
        when(leaveAccrualService.consume(vacation)).thenReturn(new BigDecimal("5.00"));
        when(loanRepository.findByEmployeeIdAndStatus(employee.getId(), LoanStatus.ACTIVE)).thenReturn(List.of(loan));

        vacationService.actOnApproval(vacation.getId(), action(firstApprover, ApprovalAction.APPROVE));
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.PAUSED);
        assertThat(vacation.getPausedLoanIds()).containsExactly(loan.getId());

        when(loanRepository.findAllById(Set.of(loan.getId()))).thenReturn(List.of(loan));
        VacationResponse cancelled = vacationService.cancel(vacation.getId(), new VacationTransitionRequest());

        assertThat(cancelled.getStatus()).isEqualTo(VacationStatus.CANCELLED);
        assertThat(cancelled.getConsumedDays()).isEqualByComparingTo("0");
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(employee.getStatus()).isEqualTo(EmployeeStatus.ACTIVE);
        verify(leaveAccrualService).restore(vacation);
    }

    @Test
    @DisplayName("Completing an approved request returns the employee to active")
    void completeRestoresEmployee() {
        VacationRequest vacation = pendingRequest(firstApprover);
        vacation.setStatus(VacationStatus.APPROVED);
        employee.setStatus(EmployeeStatus.ON_LEAVE);
        stubLookup(vacation);
        stubSave();

        VacationResponse response = vacationService.markCompleted(vacation.getId(), null);

        assertThat(response.getStatus()).isEqualTo(VacationStatus.COMPLETED);
        assertThat(employee.getStatus()).isEqualTo(EmployeeStatus.ACTIVE);
        assertThat(response.getAuditLog()).extracting("action").containsExactly(AuditAction.COMPLETED);
    }

    @Test
    @DisplayName("Only pending or approved requests can be cancelled")
    void cancelRejectedIsConflict() {
        VacationRequest vacation = pendingRequest(firstApprover);
        vacation.setStatus(VacationStatus.REJECTED);
        stubLookup(vacation);

        assertThatThrownBy(() -> vacationService.cancel(vacation.getId(), null))
                .isInstanceOf(ConflictException.class);
        verifyNoInteractions(leaveAccrualService);
    }
}

package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.VacationApprovalActionRequest;
import com.HRPayMaster.hr_backend.dto.request.VacationRequestCreateRequest;
import com.HRPayMaster.hr_backend.dto.request.VacationTransitionRequest;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.dto.response.VacationApprovalStepResponse;
import com.HRPayMaster.hr_backend.dto.response.VacationAuditEntryResponse;
import com.HRPayMaster.hr_backend.dto.response.VacationResponse;
import com.HRPayMaster.hr_backend.enums.ApprovalStepStatus;
import com.HRPayMaster.hr_backend.enums.AuditAction;
import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.exception.AuthorizationException;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.LeaveAccrualPolicy;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.model.VacationApprovalStep;
import com.HRPayMaster.hr_backend.model.VacationAuditEntry;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.LeaveAccrualPolicyRepository;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import com.HRPayMaster.hr_backend.repository.VacationRequestRepository;
import com.HRPayMaster.hr_backend.util.DateRangeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Leave requests and their approval chain.
 *
 * <pre>
 * pending --approve(last step)--> approved --complete--> completed
 * pending --reject(any step)----> rejected
 * pending | approved --cancel---> cancelled
 * </pre>
 *
 * Approval consumes the leave balance, optionally pauses the employee's active loans and marks
 * the employee on leave, all in the approving transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VacationService {

    private final VacationRequestRepository vacationRequestRepository;
    private final EmployeeRepository employeeRepository;
    private final LeaveAccrualPolicyRepository leaveAccrualPolicyRepository;
    private final LoanRepository loanRepository;
    private final LeaveAccrualService leaveAccrualService;
    private final CoverageService coverageService;
    private final Clock clock;

    @Transactional
    public VacationResponse submitVacation(VacationRequestCreateRequest request) {
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new ValidationException("Start date and end date are required");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw ValidationException.forField("vacation", "endDate", "End date must be on or after start date");
        }
        if (request.getApproverIds() == null || request.getApproverIds().isEmpty()) {
            throw ValidationException.forField("vacation", "approverIds", "At least one approver is required");
        }

        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", request.getEmployeeId()));

        LeaveAccrualPolicy appliedPolicy = null;
        if (request.getAppliedPolicyId() != null) {
            appliedPolicy = leaveAccrualPolicyRepository.findById(request.getAppliedPolicyId())
                    .orElseThrow(() -> new ResourceNotFoundException("Leave policy", "id", request.getAppliedPolicyId()));
            if (!appliedPolicy.getLeaveType().equalsIgnoreCase(request.getLeaveType().trim())) {
                throw ValidationException.forField("vacation", "appliedPolicyId",
                        "Policy covers leave type " + appliedPolicy.getLeaveType() + ", not " + request.getLeaveType());
            }
        }

        List<VacationRequest> overlapping = coverageService.findOverlappingRequests(
                employee.getId(), request.getStartDate(), request.getEndDate());
        if (!overlapping.isEmpty()) {
            VacationRequest existing = overlapping.get(0);
            throw new ConflictException(String.format("Employee already has a %s request from %s to %s",
                    existing.getStatus().toValue(), existing.getStartDate(), existing.getEndDate()),
                    "vacation_request", existing.getId());
        }

        List<VacationApprovalStep> chain = new ArrayList<>();
        for (UUID approverId : request.getApproverIds()) {
            chain.add(VacationApprovalStep.builder()
                    .approverId(approverId)
                    .status(ApprovalStepStatus.PENDING)
                    .build());
        }

        VacationRequest vacation = VacationRequest.builder()
                .employee(employee)
                .leaveType(request.getLeaveType().trim().toLowerCase())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .days(DateRangeUtil.inclusiveDays(request.getStartDate(), request.getEndDate()))
                .reason(request.getReason())
                .status(VacationStatus.PENDING)
                .appliedPolicy(appliedPolicy)
                .approvalChain(chain)
                .currentStepIndex(0)
                .pauseLoans(Boolean.TRUE.equals(request.getPauseLoans()))
                .markEmployeeOnLeave(request.getMarkEmployeeOnLeave() == null || request.getMarkEmployeeOnLeave())
                .build();
        vacation.appendAudit(audit(AuditAction.CREATED, employee.getId(), request.getReason()));

        VacationRequest saved = vacationRequestRepository.save(vacation);
        log.info("Vacation request {} submitted for employee {} ({} to {}, {} approvers)",
                saved.getId(), employee.getId(), saved.getStartDate(), saved.getEndDate(), chain.size());
        return mapToVacationResponse(saved);
    }

    /**
     * Applies one approver action to the current step. Authorization is checked before anything
     * is changed, so a refused action leaves the request untouched.
     */
    @Transactional
    public VacationResponse actOnApproval(UUID id, VacationApprovalActionRequest request) {
        VacationRequest vacation = findVacation(id);

        if (vacation.getStatus() != VacationStatus.PENDING) {
            throw new ConflictException("Vacation request is " + vacation.getStatus().toValue()
                    + " and can no longer be acted on", "vacation_request", id);
        }
        VacationApprovalStep step = vacation.getCurrentStep();
        if (step == null || step.getStatus() != ApprovalStepStatus.PENDING) {
            throw new ConflictException("Vacation request has no pending approval step", "vacation_request", id);
        }

        UUID actorId = request.getActingApproverId();
        if (!step.canBeActedOnBy(actorId)) {
            log.warn("Approver {} attempted to act on step {} of vacation request {}", actorId,
                    vacation.getCurrentStepIndex(), id);
            throw new AuthorizationException("Approver is not assigned to the current approval step");
        }

        switch (request.getAction()) {
            case APPROVE -> approveStep(vacation, step, actorId, request.getNotes());
            case REJECT -> rejectStep(vacation, step, actorId, request.getNotes());
            case DELEGATE -> delegateStep(vacation, step, actorId, request.getDelegateToId(), request.getNotes());
            case COMMENT -> vacation.appendAudit(audit(AuditAction.COMMENT, actorId, request.getNotes()));
        }

        VacationRequest saved = vacationRequestRepository.saveAndFlush(vacation);
        return mapToVacationResponse(saved);
    }

    /**
     * Closes an approved request once the employee is back.
     */
    @Transactional
    public VacationResponse markCompleted(UUID id, VacationTransitionRequest request) {
        VacationRequest vacation = findVacation(id);
        if (vacation.getStatus() != VacationStatus.APPROVED) {
            throw new ConflictException("Only approved vacation requests can be completed", "vacation_request", id);
        }

        vacation.setStatus(VacationStatus.COMPLETED);
        restoreEmployeeStatus(vacation);
        if (request == null || request.getResumeLoans() == null || request.getResumeLoans()) {
            resumeLoans(vacation);
        }
        vacation.appendAudit(audit(AuditAction.COMPLETED, actorOf(request), notesOf(request)));

        VacationRequest saved = vacationRequestRepository.saveAndFlush(vacation);
        log.info("Vacation request {} completed", id);
        return mapToVacationResponse(saved);
    }

    /**
     * Cancels a pending or approved request. Cancelling an approved request gives back its
     * leave days, the employee's status and the loans it paused.
     */
    @Transactional
    public VacationResponse cancel(UUID id, VacationTransitionRequest request) {
        VacationRequest vacation = findVacation(id);
        VacationStatus previous = vacation.getStatus();
        if (previous != VacationStatus.PENDING && previous != VacationStatus.APPROVED) {
            throw new ConflictException("Vacation request is " + previous.toValue() + " and cannot be cancelled",
                    "vacation_request", id);
        }

        if (previous == VacationStatus.APPROVED) {
            leaveAccrualService.restore(vacation);
            vacation.setConsumedDays(BigDecimal.ZERO);
            restoreEmployeeStatus(vacation);
            resumeLoans(vacation);
        }
        vacation.setStatus(VacationStatus.CANCELLED);
        vacation.appendAudit(audit(AuditAction.CANCELLED, actorOf(request), notesOf(request)));

        VacationRequest saved = vacationRequestRepository.saveAndFlush(vacation);
        log.info("Vacation request {} cancelled (was {})", id, previous.toValue());
        return mapToVacationResponse(saved);
    }

    @Transactional(readOnly = true)
    public VacationResponse getVacation(UUID id) {
        return mapToVacationResponse(findVacation(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<VacationResponse> getVacations(int page, int limit, UUID employeeId, VacationStatus status) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("startDate").descending());
        Page<VacationRequest> requests = vacationRequestRepository.findByCriteria(employeeId, status, pageable);

        List<VacationResponse> responses = requests.getContent()
                .stream()
                .map(this::mapToVacationResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, requests.getTotalElements());
    }

    private void approveStep(VacationRequest vacation, VacationApprovalStep step, UUID actorId, String notes) {
        step.setStatus(ApprovalStepStatus.APPROVED);
        step.setActedAt(LocalDateTime.now(clock));
        step.setNotes(notes);
        vacation.appendAudit(audit(AuditAction.APPROVED, actorId, notes));

        if (!vacation.isTerminalStep()) {
            vacation.setCurrentStepIndex(vacation.getCurrentStepIndex() + 1);
            log.info("Vacation request {} approved at step {}, waiting on step {}",
                    vacation.getId(), vacation.getCurrentStepIndex() - 1, vacation.getCurrentStepIndex());
            return;
        }

        vacation.setStatus(VacationStatus.APPROVED);
        applyApprovalEffects(vacation);
        log.info("Vacation request {} approved for employee {}", vacation.getId(), vacation.getEmployee().getId());
    }

    private void rejectStep(VacationRequest vacation, VacationApprovalStep step, UUID actorId, String notes) {
        step.setStatus(ApprovalStepStatus.REJECTED);
        step.setActedAt(LocalDateTime.now(clock));
        step.setNotes(notes);
        vacation.setStatus(VacationStatus.REJECTED);
        vacation.appendAudit(audit(AuditAction.REJECTED, actorId, notes));
        log.info("Vacation request {} rejected at step {}", vacation.getId(), vacation.getCurrentStepIndex());
    }

    private void delegateStep(VacationRequest vacation, VacationApprovalStep step, UUID actorId,
                              UUID delegateToId, String notes) {
        if (delegateToId == null) {
            throw ValidationException.forField("approval", "delegateToId", "Delegate is required");
        }
        if (delegateToId.equals(actorId)) {
            throw ValidationException.forField("approval", "delegateToId", "Cannot delegate to yourself");
        }
        step.setDelegatedToId(delegateToId);
        vacation.appendAudit(audit(AuditAction.DELEGATED, actorId,
                notes != null ? notes : "Delegated to " + delegateToId));
        log.info("Step {} of vacation request {} delegated to {}", vacation.getCurrentStepIndex(), vacation.getId(), delegateToId);
    }

    private void applyApprovalEffects(VacationRequest vacation) {
        vacation.setConsumedDays(leaveAccrualService.consume(vacation));

        Employee employee = vacation.getEmployee();
        if (vacation.isPauseLoans()) {
            for (Loan loan : loanRepository.findByEmployeeIdAndStatus(employee.getId(), LoanStatus.ACTIVE)) {
                loan.setStatus(LoanStatus.PAUSED);
                loanRepository.save(loan);
                vacation.getPausedLoanIds().add(loan.getId());
            }
            log.info("Paused {} loans of employee {} for vacation {}",
                    vacation.getPausedLoanIds().size(), employee.getId(), vacation.getId());
        }

        if (vacation.isMarkEmployeeOnLeave() && employee.getStatus() == EmployeeStatus.ACTIVE) {
            employee.setStatus(EmployeeStatus.ON_LEAVE);
            employeeRepository.save(employee);
        }
    }

    private void restoreEmployeeStatus(VacationRequest vacation) {
        Employee employee = vacation.getEmployee();
        if (vacation.isMarkEmployeeOnLeave() && employee.getStatus() == EmployeeStatus.ON_LEAVE) {
            employee.setStatus(EmployeeStatus.ACTIVE);
            employeeRepository.save(employee);
        }
    }

    private void resumeLoans(VacationRequest vacation) {
        if (vacation.getPausedLoanIds().isEmpty()) {
            return;
        }
        for (Loan loan : loanRepository.findAllById(vacation.getPausedLoanIds())) {
            // A loan settled or changed by hand meanwhile stays as it is
            if (loan.getStatus() == LoanStatus.PAUSED) {
                loan.setStatus(LoanStatus.ACTIVE);
                loanRepository.save(loan);
            }
        }
        log.info("Resumed {} loans paused by vacation {}", vacation.getPausedLoanIds().size(), vacation.getId());
        vacation.getPausedLoanIds().clear();
    }

    private VacationAuditEntry audit(AuditAction action, UUID actorId, String notes) {
        return VacationAuditEntry.builder()
                .action(action)
                .actorId(actorId)
                .notes(notes)
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    private static UUID actorOf(VacationTransitionRequest request) {
        return request != null ? request.getActorId() : null;
    }

    private static String notesOf(VacationTransitionRequest request) {
        return request != null ? request.getNotes() : null;
    }

    private VacationRequest findVacation(UUID id) {
        return vacationRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Vacation request", "id", id));
    }

    private VacationResponse mapToVacationResponse(VacationRequest vacation) {
        List<VacationApprovalStepResponse> chain = vacation.getApprovalChain().stream()
                .map(step -> VacationApprovalStepResponse.builder()
                        .approverId(step.getApproverId())
                        .status(step.getStatus())
                        .delegatedToId(step.getDelegatedToId())
                        .actedAt(step.getActedAt())
                        .notes(step.getNotes())
                        .build())
                .collect(Collectors.toList());

        List<VacationAuditEntryResponse> auditLog = vacation.getAuditLog().stream()
                .map(entry -> VacationAuditEntryResponse.builder()
                        .action(entry.getAction())
                        .actorId(entry.getActorId())
                        .notes(entry.getNotes())
                        .timestamp(entry.getTimestamp())
                        .build())
                .collect(Collectors.toList());

        return VacationResponse.builder()
                .id(vacation.getId())
                .employeeId(vacation.getEmployee().getId())
                .employeeName(vacation.getEmployee().getFullName())
                .leaveType(vacation.getLeaveType())
                .startDate(vacation.getStartDate())
                .endDate(vacation.getEndDate())
                .days(vacation.getDays())
                .reason(vacation.getReason())
                .status(vacation.getStatus())
                .appliedPolicyId(vacation.getAppliedPolicy() != null ? vacation.getAppliedPolicy().getId() : null)
                .currentStepIndex(vacation.getCurrentStepIndex())
                .approvalChain(chain)
                .auditLog(auditLog)
                .pauseLoans(vacation.isPauseLoans())
                .markEmployeeOnLeave(vacation.isMarkEmployeeOnLeave())
                .consumedDays(vacation.getConsumedDays())
                .version(vacation.getVersion())
                .createdAt(vacation.getCreatedAt())
                .updatedAt(vacation.getUpdatedAt())
                .build();
    }
}

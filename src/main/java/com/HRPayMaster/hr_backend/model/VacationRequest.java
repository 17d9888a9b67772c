package com.HRPayMaster.hr_backend.model;

import com.HRPayMaster.hr_backend.enums.VacationStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A leave request and its approval chain. The chain and the audit log are owned by the request;
 * {@code currentStepIndex} points at the step awaiting action.
 */
@Entity
@Table(name = "vacation_requests")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VacationRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(nullable = false)
    private String leaveType;

    @Column(nullable = false)
    private LocalDate startDate;

    @Column(nullable = false)
    private LocalDate endDate;

    @Column(nullable = false)
    private int days;

    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private VacationStatus status = VacationStatus.PENDING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "applied_policy_id")
    private LeaveAccrualPolicy appliedPolicy;

    @ElementCollection
    @CollectionTable(name = "vacation_approval_steps", joinColumns = @JoinColumn(name = "vacation_request_id"))
    @OrderColumn(name = "step_order")
    @Builder.Default
    private List<VacationApprovalStep> approvalChain = new ArrayList<>();

    @Builder.Default
    private int currentStepIndex = 0;

    @ElementCollection
    @CollectionTable(name = "vacation_audit_log", joinColumns = @JoinColumn(name = "vacation_request_id"))
    @OrderColumn(name = "entry_order")
    @Builder.Default
    private List<VacationAuditEntry> auditLog = new ArrayList<>();

    @Builder.Default
    private boolean pauseLoans = false;

    @Builder.Default
    private boolean markEmployeeOnLeave = true;

    @ElementCollection
    @CollectionTable(name = "vacation_paused_loans", joinColumns = @JoinColumn(name = "vacation_request_id"))
    @Column(name = "loan_id")
    @Builder.Default
    private Set<UUID> pausedLoanIds = new HashSet<>();

    // Days taken from the leave balance on approval, zero when no policy covered the request
    @Column(precision = 7, scale = 2)
    @Builder.Default
    private BigDecimal consumedDays = BigDecimal.ZERO;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public VacationApprovalStep getCurrentStep() {
        if (currentStepIndex < 0 || currentStepIndex >= approvalChain.size()) {
            return null;
        }
        return approvalChain.get(currentStepIndex);
    }

    public boolean isTerminalStep() {
        return currentStepIndex == approvalChain.size() - 1;
    }

    public void appendAudit(VacationAuditEntry entry) {
        auditLog.add(entry);
    }
}

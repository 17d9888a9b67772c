package com.HRPayMaster.hr_backend.model;

import com.HRPayMaster.hr_backend.enums.ApprovalStepStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VacationApprovalStep {

    @Column(nullable = false)
    private UUID approverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ApprovalStepStatus status = ApprovalStepStatus.PENDING;

    private UUID delegatedToId;

    private LocalDateTime actedAt;

    private String notes;

    public boolean canBeActedOnBy(UUID actorId) {
        return actorId != null && (actorId.equals(approverId) || actorId.equals(delegatedToId));
    }
}

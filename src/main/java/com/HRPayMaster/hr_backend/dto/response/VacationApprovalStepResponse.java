package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.ApprovalStepStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VacationApprovalStepResponse {
    private UUID approverId;
    private ApprovalStepStatus status;
    private UUID delegatedToId;
    private LocalDateTime actedAt;
    private String notes;
}

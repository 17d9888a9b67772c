package com.HRPayMaster.hr_backend.dto.request;

import com.HRPayMaster.hr_backend.enums.ApprovalAction;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VacationApprovalActionRequest {

    @NotNull(message = "Acting approver ID is required")
    private UUID actingApproverId;

    @NotNull(message = "Action is required")
    private ApprovalAction action;

    private UUID delegateToId;

    @Size(max = 1000, message = "Notes must not exceed 1000 characters")
    private String notes;
}

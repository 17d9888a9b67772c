package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.VacationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VacationResponse {
    private UUID id;
    private UUID employeeId;
    private String employeeName;
    private String leaveType;
    private LocalDate startDate;
    private LocalDate endDate;
    private int days;
    private String reason;
    private VacationStatus status;
    private UUID appliedPolicyId;
    private int currentStepIndex;
    private List<VacationApprovalStepResponse> approvalChain;
    private List<VacationAuditEntryResponse> auditLog;
    private boolean pauseLoans;
    private boolean markEmployeeOnLeave;
    private BigDecimal consumedDays;
    private Long version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

package com.HRPayMaster.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeavePolicyAssignmentResponse {
    private UUID id;
    private UUID employeeId;
    private UUID policyId;
    private String policyName;
    private String leaveType;
    private LocalDate effectiveFrom;
    private LocalDate effectiveTo;
    private BigDecimal customAccrualRate;
}

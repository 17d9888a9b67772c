package com.HRPayMaster.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
public class LeavePolicyAssignmentRequest {

    @NotNull(message = "Employee ID is required")
    private UUID employeeId;

    @NotNull(message = "Policy ID is required")
    private UUID policyId;

    @NotNull(message = "Effective from date is required")
    private LocalDate effectiveFrom;

    private LocalDate effectiveTo;

    @DecimalMin(value = "0.0", message = "Custom accrual rate cannot be negative")
    private BigDecimal customAccrualRate;
}

package com.HRPayMaster.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class LeavePolicyRequest {

    @NotBlank(message = "Policy name is required")
    private String name;

    @NotBlank(message = "Leave type is required")
    private String leaveType;

    @NotNull(message = "Accrual rate is required")
    @DecimalMin(value = "0.0", message = "Accrual rate cannot be negative")
    private BigDecimal accrualRatePerMonth;

    @DecimalMin(value = "0.0", message = "Max balance cannot be negative")
    private BigDecimal maxBalanceDays;

    @DecimalMin(value = "0.0", message = "Carryover limit cannot be negative")
    private BigDecimal carryoverLimitDays;

    private Boolean allowNegativeBalance;

    @NotNull(message = "Effective from date is required")
    private LocalDate effectiveFrom;

    private LocalDate expiresOn;
}

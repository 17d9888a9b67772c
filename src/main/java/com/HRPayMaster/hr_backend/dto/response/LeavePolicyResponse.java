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
public class LeavePolicyResponse {
    private UUID id;
    private String name;
    private String leaveType;
    private BigDecimal accrualRatePerMonth;
    private BigDecimal maxBalanceDays;
    private BigDecimal carryoverLimitDays;
    private boolean allowNegativeBalance;
    private LocalDate effectiveFrom;
    private LocalDate expiresOn;
}

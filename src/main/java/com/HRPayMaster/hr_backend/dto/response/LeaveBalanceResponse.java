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
public class LeaveBalanceResponse {
    private UUID id;
    private UUID employeeId;
    private String leaveType;
    private int year;
    private BigDecimal accruedDays;
    private BigDecimal usedDays;
    private BigDecimal carriedOverDays;
    private BigDecimal balanceDays;
    private LocalDate lastAccrualDate;
}

package com.HRPayMaster.hr_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayrollEntryResponse {
    private UUID id;
    private UUID employeeId;
    private String employeeName;
    private String employeeCode;
    private BigDecimal baseSalary;
    private BigDecimal bonusAmount;
    private Map<String, BigDecimal> allowances;
    private int workingDays;
    private int actualWorkingDays;
    private Integer vacationDays;
    private BigDecimal taxDeduction;
    private BigDecimal socialSecurityDeduction;
    private BigDecimal healthInsuranceDeduction;
    private BigDecimal loanDeduction;
    private BigDecimal otherDeductions;
    private BigDecimal grossPay;
    private BigDecimal netPay;
    private String adjustmentReason;
}

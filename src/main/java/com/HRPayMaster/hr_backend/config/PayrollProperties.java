package com.HRPayMaster.hr_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "hr.payroll")
public class PayrollProperties {
    private int defaultWorkingDays = 26;
    private String currency = "KWD";
    // Loan deduction share of salary above which a loan is refused or flagged
    private double loanDeductionHardLimit = 0.50;
    private double loanDeductionWarningLimit = 0.35;
}

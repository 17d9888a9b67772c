package com.HRPayMaster.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class PayrollEntryUpdateRequest {

    @DecimalMin(value = "0.0", message = "Bonus amount cannot be negative")
    private BigDecimal bonusAmount;

    @DecimalMin(value = "0.0", message = "Other deductions cannot be negative")
    private BigDecimal otherDeductions;

    @Size(max = 1000, message = "Adjustment reason must not exceed 1000 characters")
    private String adjustmentReason;
}

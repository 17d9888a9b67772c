package com.HRPayMaster.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class AmortizationRequest {

    @NotNull(message = "Principal is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Principal must be greater than 0")
    private BigDecimal principal;

    @NotNull(message = "Monthly payment is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Monthly payment must be greater than 0")
    private BigDecimal monthlyPayment;

    @DecimalMin(value = "0.0", message = "Interest rate cannot be negative")
    private BigDecimal annualInterestRate;

    private LocalDate startDate;
}

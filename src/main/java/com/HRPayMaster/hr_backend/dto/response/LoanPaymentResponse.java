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
public class LoanPaymentResponse {
    private UUID id;
    private UUID loanId;
    private UUID payrollRunId;
    private BigDecimal amount;
    private LocalDate paymentDate;
    private String source;
    private String notes;
}

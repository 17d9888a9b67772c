package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.LoanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanResponse {
    private UUID id;
    private UUID employeeId;
    private String employeeName;
    private BigDecimal amount;
    private BigDecimal monthlyDeduction;
    private BigDecimal remainingAmount;
    private BigDecimal interestRate;
    private LocalDate startDate;
    private LocalDate endDate;
    private LoanStatus status;
    private String reason;
    private List<String> warnings;
    private LocalDateTime createdAt;
}

package com.HRPayMaster.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmortizationScheduleResponse {
    private BigDecimal principal;
    private BigDecimal monthlyPayment;
    private BigDecimal annualInterestRate;
    private BigDecimal totalInterest;
    private BigDecimal totalPaid;
    private List<Installment> installments;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Installment {
        private int installmentNumber;
        private LocalDate dueDate;
        private BigDecimal openingBalance;
        private BigDecimal principalAmount;
        private BigDecimal interestAmount;
        private BigDecimal paymentAmount;
        private BigDecimal closingBalance;
    }
}

package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.PayrollStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayrollRunResponse {
    private UUID id;
    private String period;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal grossAmount;
    private BigDecimal totalDeductions;
    private BigDecimal netAmount;
    private PayrollStatus status;
    private Map<String, Boolean> scenarioToggles;
    private int employeeCount;
    private List<String> allowanceKeys;
    private List<PayrollEntryResponse> entries;
    private LocalDateTime createdAt;
}

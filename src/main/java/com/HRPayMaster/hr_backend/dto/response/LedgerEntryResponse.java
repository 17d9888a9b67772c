package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.LedgerEntryType;
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
public class LedgerEntryResponse {
    private UUID id;
    private UUID policyId;
    private String leaveType;
    private LedgerEntryType entryType;
    private LocalDate entryDate;
    private String sourceKey;
    private BigDecimal amount;
    private String notes;
}

package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.AuditAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VacationAuditEntryResponse {
    private AuditAction action;
    private UUID actorId;
    private String notes;
    private LocalDateTime timestamp;
}

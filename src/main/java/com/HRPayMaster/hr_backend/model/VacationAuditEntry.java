package com.HRPayMaster.hr_backend.model;

import com.HRPayMaster.hr_backend.enums.AuditAction;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VacationAuditEntry {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AuditAction action;

    private UUID actorId;

    private String notes;

    @Column(nullable = false)
    private LocalDateTime timestamp;
}

package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditAction {
    CREATED,
    APPROVED,
    REJECTED,
    DELEGATED,
    COMMENT,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}

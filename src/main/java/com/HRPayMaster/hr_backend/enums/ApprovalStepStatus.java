package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalStepStatus {
    PENDING,
    APPROVED,
    REJECTED;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}

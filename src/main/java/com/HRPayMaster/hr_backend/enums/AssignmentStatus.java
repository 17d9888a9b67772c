package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssignmentStatus {
    ACTIVE,
    COMPLETED;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}

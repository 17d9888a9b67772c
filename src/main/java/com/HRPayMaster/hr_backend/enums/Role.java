package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN,
    HR,
    MANAGER,
    EMPLOYEE;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}

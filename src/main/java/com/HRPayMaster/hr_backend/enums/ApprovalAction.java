package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalAction {
    APPROVE,
    REJECT,
    DELEGATE,
    COMMENT;

    @JsonCreator
    public static ApprovalAction fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            // Accept both uppercase and lowercase
            return ApprovalAction.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name().toLowerCase();
    }
}

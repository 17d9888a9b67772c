package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum NotificationType {
    VACATION_APPROVED("vacation_approved", "Vacation Deduction Applied"),
    LOAN_DEDUCTION("loan_deduction", "Loan Deduction Applied"),
    VACATION_RETURN_DUE("vacation_return_due", "Vacation return due");

    private final String value;
    private final String defaultTitle;

    NotificationType(String value, String defaultTitle) {
        this.value = value;
        this.defaultTitle = defaultTitle;
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}

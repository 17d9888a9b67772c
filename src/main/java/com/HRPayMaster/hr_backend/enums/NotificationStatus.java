package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationStatus {
    UNREAD,
    READ,
    DISMISSED;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}

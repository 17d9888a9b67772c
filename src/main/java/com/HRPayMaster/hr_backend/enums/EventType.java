package com.HRPayMaster.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

@Getter
public enum EventType {
    BONUS("bonus"),
    COMMISSION("commission"),
    ALLOWANCE("allowance"),
    OVERTIME("overtime"),
    DEDUCTION("deduction"),
    PENALTY("penalty"),
    VACATION("vacation"),
    OTHER("other");

    private static final Set<EventType> ADDITIONS = EnumSet.of(BONUS, COMMISSION, ALLOWANCE, OVERTIME);
    private static final Set<EventType> SUBTRACTIONS = EnumSet.of(DEDUCTION, PENALTY);

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public boolean isAddition() {
        return ADDITIONS.contains(this);
    }

    public boolean isSubtraction() {
        return SUBTRACTIONS.contains(this);
    }

    @JsonCreator
    public static EventType fromString(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String input = text.trim().toLowerCase();
        for (EventType type : EventType.values()) {
            if (type.value.equals(input)) {
                return type;
            }
        }
        switch (input) {
            case "bonuses":
                return BONUS;
            case "allowances":
                return ALLOWANCE;
            case "deductions":
                return DEDUCTION;
            case "penalties":
                return PENALTY;
            default:
                return OTHER;
        }
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}

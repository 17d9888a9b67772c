package com.HRPayMaster.hr_backend.enums;

public enum LedgerEntryType {
    ACCRUAL,
    CONSUMPTION,
    RESTORATION,
    CARRYOVER,
    CARRYOVER_FORFEIT
}

package com.HRPayMaster.hr_backend.exception;

import java.math.BigDecimal;

public class InsufficientLeaveBalanceException extends ComputationException {
    public InsufficientLeaveBalanceException(String leaveType, BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient %s leave balance. Available: %s, Requested: %s",
                        leaveType, available.toPlainString(), requested.toPlainString()),
                "INSUFFICIENT_LEAVE_BALANCE");
    }
}

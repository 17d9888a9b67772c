package com.HRPayMaster.hr_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Payroll Constants
    public static final int MONEY_SCALE = 2;
    public static final String UNASSIGNED_DEPARTMENT = "unassigned";

    // Loan Constants
    public static final int MAX_AMORTIZATION_INSTALLMENTS = 600;
    public static final String LOAN_PAYMENT_SOURCE_PAYROLL = "payroll";
    public static final String LOAN_PAYMENT_SOURCE_MANUAL = "manual";

    // Vacation return alerts
    public static final int RETURN_ALERT_LOOKAHEAD_DAYS = 2;
    public static final int RETURN_ALERT_OVERDUE_DAYS = 7;

    // Error Messages
    public static final String ERROR_PAYROLL_PERIOD_EXISTS = "Payroll run already exists for this period";
}

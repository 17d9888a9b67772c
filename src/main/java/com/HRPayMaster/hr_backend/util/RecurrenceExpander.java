package com.HRPayMaster.hr_backend.util;

import com.HRPayMaster.hr_backend.enums.RecurrenceType;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects a stored employee event onto a period. A monthly event yields one occurrence per
 * month of the period on the original day-of-month (clamped to the month length); a one-off
 * event yields its own date when that falls inside the period.
 */
public class RecurrenceExpander {

    private RecurrenceExpander() {
        // Utility class, no instantiation
    }

    public static List<LocalDate> occurrences(LocalDate eventDate,
                                              RecurrenceType recurrenceType,
                                              LocalDate recurrenceEndDate,
                                              LocalDate periodStart,
                                              LocalDate periodEnd) {
        List<LocalDate> dates = new ArrayList<>();
        if (eventDate == null || periodStart == null || periodEnd == null || periodEnd.isBefore(periodStart)) {
            return dates;
        }

        if (recurrenceType != RecurrenceType.MONTHLY) {
            if (DateRangeUtil.contains(periodStart, periodEnd, eventDate)) {
                dates.add(eventDate);
            }
            return dates;
        }

        if (eventDate.isAfter(periodEnd)) {
            return dates;
        }
        if (recurrenceEndDate != null && recurrenceEndDate.isBefore(periodStart)) {
            return dates;
        }

        int dayOfMonth = eventDate.getDayOfMonth();
        YearMonth month = YearMonth.from(periodStart);
        YearMonth lastMonth = YearMonth.from(periodEnd);
        while (!month.isAfter(lastMonth)) {
            LocalDate candidate = month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
            boolean inPeriod = DateRangeUtil.contains(periodStart, periodEnd, candidate);
            boolean afterOrigin = !candidate.isBefore(eventDate);
            boolean beforeEnd = recurrenceEndDate == null || !candidate.isAfter(recurrenceEndDate);
            if (inPeriod && afterOrigin && beforeEnd) {
                dates.add(candidate);
            }
            month = month.plusMonths(1);
        }
        return dates;
    }
}

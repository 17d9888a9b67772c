package com.HRPayMaster.hr_backend.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Inclusive date-range helpers shared by payroll, leave and coverage calculations.
 * Every range here is closed on both ends.
 */
public class DateRangeUtil {

    private DateRangeUtil() {
        // Utility class, no instantiation
    }

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    public static String formatDate(LocalDate date) {
        return date != null ? date.format(DATE_FORMATTER) : null;
    }

    /**
     * Number of calendar days in {@code [start, end]}; zero when end precedes start.
     */
    public static int inclusiveDays(LocalDate start, LocalDate end) {
        if (start == null || end == null || end.isBefore(start)) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public static boolean overlaps(LocalDate startA, LocalDate endA, LocalDate startB, LocalDate endB) {
        return !startA.isAfter(endB) && !endA.isBefore(startB);
    }

    public static boolean contains(LocalDate start, LocalDate end, LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    /**
     * Intersection of {@code [start, end]} with the window, or empty when they do not meet.
     */
    public static Optional<DateRange> clip(LocalDate start, LocalDate end, LocalDate windowStart, LocalDate windowEnd) {
        if (!overlaps(start, end, windowStart, windowEnd)) {
            return Optional.empty();
        }
        LocalDate from = start.isBefore(windowStart) ? windowStart : start;
        LocalDate to = end.isAfter(windowEnd) ? windowEnd : end;
        return Optional.of(new DateRange(from, to));
    }

    /**
     * Merges overlapping or adjacent ranges and returns the union.
     */
    public static List<DateRange> merge(List<DateRange> ranges) {
        List<DateRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparing(DateRange::start).thenComparing(DateRange::end));

        List<DateRange> merged = new ArrayList<>();
        for (DateRange range : sorted) {
            if (merged.isEmpty()) {
                merged.add(range);
                continue;
            }
            DateRange last = merged.get(merged.size() - 1);
            if (!range.start().isAfter(last.end().plusDays(1))) {
                LocalDate end = range.end().isAfter(last.end()) ? range.end() : last.end();
                merged.set(merged.size() - 1, new DateRange(last.start(), end));
            } else {
                merged.add(range);
            }
        }
        return merged;
    }

    public static int countMergedDays(List<DateRange> ranges) {
        return merge(ranges).stream()
                .mapToInt(range -> inclusiveDays(range.start(), range.end()))
                .sum();
    }

    public record DateRange(LocalDate start, LocalDate end) {
        public DateRange {
            if (start == null || end == null || end.isBefore(start)) {
                throw new IllegalArgumentException("Invalid date range: " + start + " to " + end);
            }
        }
    }
}

package com.intelmonitor.aggregation;

import com.intelmonitor.domain.enums.AggregationPeriod;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * A rollup window: start inclusive, end exclusive.
 */
public record AggregationWindow(AggregationPeriod period, LocalDateTime start, LocalDateTime end) {

    public static AggregationWindow daily(LocalDate date) {
        LocalDateTime start = date.atStartOfDay();
        return new AggregationWindow(AggregationPeriod.DAILY, start, start.plusDays(1));
    }

    /** Monday-to-Monday week containing {@code date}. */
    public static AggregationWindow weekly(LocalDate date) {
        LocalDateTime start = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
        return new AggregationWindow(AggregationPeriod.WEEKLY, start, start.plusWeeks(1));
    }

    /** Calendar month; December ends at January 1st of the next year. */
    public static AggregationWindow monthly(int year, int month) {
        LocalDateTime start = LocalDate.of(year, month, 1).atStartOfDay();
        return new AggregationWindow(AggregationPeriod.MONTHLY, start, start.plusMonths(1));
    }

    public static AggregationWindow of(AggregationPeriod period, LocalDate date) {
        return switch (period) {
            case DAILY -> daily(date);
            case WEEKLY -> weekly(date);
            case MONTHLY -> monthly(date.getYear(), date.getMonthValue());
        };
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    /** The window immediately after this one. */
    public AggregationWindow next() {
        return of(period, end.toLocalDate());
    }
}

package io.seriesfetch.analytics;

import java.time.Clock;
import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Resolves user-facing date options into ranges. Open-ended windows end yesterday: upstream needs a day or two
 * to finish processing, so today is never complete.
 */
public final class DateRanges {
    private DateRanges() {}

    public static LocalDate yesterday(Clock clock) {
        return LocalDate.now(clock).minusDays(1);
    }

    /** The {@code days} days ending yesterday. */
    public static DateRange lastDays(int days, Clock clock) {
        if (days <= 0) throw new InvalidRangeException("days must be positive: " + days);
        LocalDate end = yesterday(clock);
        return new DateRange(end.minusDays(days - 1L), end);
    }

    /**
     * {@code start} and {@code end} when both are given, {@code start} through yesterday when only {@code start} is,
     * otherwise the last {@code days} (or {@code defaultDays}) days.
     */
    public static DateRange resolve(Integer days, LocalDate start, LocalDate end, int defaultDays, Clock clock) {
        if (start != null) {
            return new DateRange(start, end != null ? end : yesterday(clock));
        }
        if (end != null) {
            int n = days != null ? days : defaultDays;
            if (n <= 0) throw new InvalidRangeException("days must be positive: " + n);
            return new DateRange(end.minusDays(n - 1L), end);
        }
        return lastDays(days != null ? days : defaultDays, clock);
    }

    /** The range of equal length that ends the day before {@code current} starts. */
    public static DateRange previousPeriod(DateRange current) {
        LocalDate end = current.start().minusDays(1);
        return new DateRange(end.minusDays(current.days() - 1), end);
    }

    /** Percentage change from {@code previous} to {@code current}; empty when {@code previous} is 0. */
    public static OptionalDouble delta(double current, double previous) {
        if (previous == 0) return OptionalDouble.empty();
        return OptionalDouble.of((current - previous) / previous * 100.0);
    }
}

package io.seriesfetch.analytics;

import java.time.temporal.ChronoUnit;

/**
 * Time bucketing of a request. Picked from the total span of the requested range.
 */
public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    static final long DAILY_MAX_DAYS = 90;
    static final long WEEKLY_MAX_DAYS = 364;

    /** Up to three months daily, under a year weekly, monthly beyond. */
    public static Granularity forSpan(long days) {
        if (days <= DAILY_MAX_DAYS) return DAILY;
        if (days <= WEEKLY_MAX_DAYS) return WEEKLY;
        return MONTHLY;
    }

    /** Days, weeks or calendar months a range touches at this granularity. */
    public long expectedRows(DateRange range) {
        switch (this) {
            case DAILY:
                return range.days();
            case WEEKLY:
                return (range.days() + 6) / 7;
            case MONTHLY:
                return ChronoUnit.MONTHS.between(range.start().withDayOfMonth(1), range.end().withDayOfMonth(1)) + 1;
            default:
                throw new IllegalStateException("unknown granularity " + this);
        }
    }
}

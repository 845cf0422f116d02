package io.seriesfetch.analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a range into API-legal sub-ranges, left to right, each as long as allowed except the last.
 */
public class RangeSplitter {
    private static final Logger log = LoggerFactory.getLogger(RangeSplitter.class);

    /** Longest range, in days, the upstream API accepts in one call. */
    public static final int MAX_SPAN_DAYS = 427;

    private final int maxSpanDays;

    public RangeSplitter() {
        this(MAX_SPAN_DAYS);
    }

    public RangeSplitter(int maxSpanDays) {
        if (maxSpanDays <= 0) throw new IllegalArgumentException("maxSpanDays must be positive: " + maxSpanDays);
        this.maxSpanDays = maxSpanDays;
    }

    public int maxSpanDays() { return maxSpanDays; }

    public Granularity granularityFor(DateRange range) {
        return Granularity.forSpan(range.days());
    }

    public QueryPlan plan(LocalDate start, LocalDate end) {
        return plan(new DateRange(start, end));
    }

    public QueryPlan plan(DateRange range) {
        Granularity granularity = granularityFor(range);
        List<QueryPlan.Step> steps = new ArrayList<>();
        LocalDate cursor = range.start();
        while (!cursor.isAfter(range.end())) {
            LocalDate stepEnd = cursor.plusDays(maxSpanDays - 1L);
            if (stepEnd.isAfter(range.end())) stepEnd = range.end();
            steps.add(new QueryPlan.Step(steps.size(), new DateRange(cursor, stepEnd), granularity));
            cursor = stepEnd.plusDays(1);
        }
        log.debug("Planned {} ({} days, {}) as {} sub-range(s)", range, range.days(), granularity, steps.size());
        return new QueryPlan(range, granularity, steps);
    }
}

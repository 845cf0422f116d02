package io.seriesfetch.analytics;

import java.util.List;
import java.util.Objects;

/**
 * Ordered sub-ranges covering {@link #range()} exactly once.
 */
public record QueryPlan(DateRange range, Granularity granularity, List<Step> steps) {
    public QueryPlan {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(granularity, "granularity");
        steps = List.copyOf(steps);
    }

    public int size() { return steps.size(); }

    /** One upstream call: its position in the plan and the days it covers. */
    public record Step(int index, DateRange range, Granularity granularity) {}
}

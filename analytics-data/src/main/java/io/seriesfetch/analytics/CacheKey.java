package io.seriesfetch.analytics;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Identity of a whole-range fetch. Metric and dimension order never changes the key.
 */
public record CacheKey(String propertyId, List<String> metrics, List<String> dimensions,
                       LocalDate start, LocalDate end, Granularity granularity) {
    public CacheKey {
        Objects.requireNonNull(propertyId, "propertyId");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(granularity, "granularity");
        metrics = metrics.stream().sorted().distinct().collect(Collectors.toUnmodifiableList());
        dimensions = dimensions.stream().sorted().distinct().collect(Collectors.toUnmodifiableList());
    }

    public static CacheKey of(String propertyId, MetricRequest request, DateRange range, Granularity granularity) {
        return new CacheKey(propertyId, request.metrics(), request.dimensions(), range.start(), range.end(), granularity);
    }

    /** {@code propertyId:metrics:dimensions:start:end:GRANULARITY}, lists comma-joined. */
    public String asString() {
        return propertyId + ':' + String.join(",", metrics) + ':' + String.join(",", dimensions)
                + ':' + start + ':' + end + ':' + granularity;
    }

    @Override
    public String toString() {
        return asString();
    }
}

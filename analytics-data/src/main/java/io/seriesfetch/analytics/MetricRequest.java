package io.seriesfetch.analytics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Validated metric and dimension names of one logical request. Duplicates are dropped, order is kept.
 */
public record MetricRequest(List<String> metrics, List<String> dimensions) {
    public MetricRequest {
        metrics = distinct(metrics);
        dimensions = distinct(dimensions);
        MetricCatalog.validate(metrics, dimensions);
    }

    public static MetricRequest of(Collection<String> metrics, Collection<String> dimensions) {
        return new MetricRequest(
                metrics == null ? List.of() : new ArrayList<>(metrics),
                dimensions == null ? List.of() : new ArrayList<>(dimensions));
    }

    private static List<String> distinct(List<String> names) {
        if (names == null) return List.of();
        return List.copyOf(new LinkedHashSet<>(names));
    }
}

package io.seriesfetch.analytics;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One day of a series, metric name to value.
 */
public record NormalizedRow(LocalDate date, Map<String, Double> values) {
    public NormalizedRow {
        Objects.requireNonNull(date, "date");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** The metric's value, 0 when the row has none. */
    public double value(String metric) {
        Double v = values.get(metric);
        return v == null ? 0.0 : v;
    }

    public NormalizedRow with(String metric, double value) {
        Map<String, Double> copy = new LinkedHashMap<>(values);
        copy.put(metric, value);
        return new NormalizedRow(date, copy);
    }
}

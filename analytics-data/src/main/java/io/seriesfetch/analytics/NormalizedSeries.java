package io.seriesfetch.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Rows strictly increasing by date.
 */
public final class NormalizedSeries {
    private static final NormalizedSeries EMPTY = new NormalizedSeries(List.of());

    private final List<NormalizedRow> rows;

    public NormalizedSeries(List<NormalizedRow> rows) {
        List<NormalizedRow> copy = List.copyOf(rows);
        for (int i = 1; i < copy.size(); i++) {
            LocalDate prev = copy.get(i - 1).date();
            LocalDate cur = copy.get(i).date();
            if (!cur.isAfter(prev)) {
                throw new IllegalArgumentException("rows must be strictly increasing by date: " + prev + " then " + cur);
            }
        }
        this.rows = copy;
    }

    public static NormalizedSeries empty() { return EMPTY; }

    /** Joins consecutive parts; each part must start after the previous one ends. */
    public static NormalizedSeries concat(List<NormalizedSeries> parts) {
        List<NormalizedRow> all = new ArrayList<>();
        for (NormalizedSeries p : parts) all.addAll(p.rows);
        return new NormalizedSeries(all);
    }

    @JsonValue
    public List<NormalizedRow> rows() { return rows; }

    public int size() { return rows.size(); }

    public boolean isEmpty() { return rows.isEmpty(); }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(rows.size());
        for (NormalizedRow r : rows) out.add(r.date());
        return out;
    }

    public double sum(String metric) {
        double total = 0;
        for (NormalizedRow r : rows) total += r.value(metric);
        return total;
    }

    /** True when the series has exactly one row for every day of {@code range}. */
    public boolean coversDaily(DateRange range) {
        if (rows.size() != range.days()) return false;
        return rows.isEmpty() || (rows.get(0).date().equals(range.start()) && rows.get(rows.size() - 1).date().equals(range.end()));
    }

    /** A copy with {@code metric} added to every row, computed from that row. */
    public NormalizedSeries withDerived(String metric, ToDoubleFunction<NormalizedRow> fn) {
        List<NormalizedRow> out = new ArrayList<>(rows.size());
        for (NormalizedRow r : rows) out.add(r.with(metric, fn.applyAsDouble(r)));
        return new NormalizedSeries(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedSeries)) return false;
        return rows.equals(((NormalizedSeries) o).rows);
    }

    @Override
    public int hashCode() { return rows.hashCode(); }

    @Override
    public String toString() {
        if (rows.isEmpty()) return "NormalizedSeries[]";
        return "NormalizedSeries[" + rows.size() + " rows, " + rows.get(0).date() + ".." + rows.get(rows.size() - 1).date() + "]";
    }
}

package io.seriesfetch.analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a raw upstream report into a date-ordered series.
 *
 * <p>Values are looked up through the headers, not by assumed position. The {@code date} dimension arrives as
 * {@code yyyyMMdd}. A requested metric missing from the response reads as 0. Rows whose value counts disagree with
 * the headers, unparsable dates or numbers, and repeated dates are rejected as malformed. Rows are never aggregated
 * across dates.
 */
public class ResponseNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    static final DateTimeFormatter UPSTREAM_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public NormalizedSeries normalize(RawResponse raw, Collection<String> requestedMetrics) {
        return new NormalizedSeries(new ArrayList<>(parse(raw, requestedMetrics).values()));
    }

    /**
     * As {@link #normalize(RawResponse, Collection)}, then drops rows outside {@code range}, logging a warning when
     * there are any, and adds a zero row for every day of {@code range} the response left out.
     */
    public NormalizedSeries normalize(RawResponse raw, Collection<String> requestedMetrics, DateRange range) {
        TreeMap<LocalDate, NormalizedRow> byDate = parse(raw, requestedMetrics);
        int outside = byDate.size();
        byDate.headMap(range.start(), false).clear();
        byDate.tailMap(range.end(), false).clear();
        outside -= byDate.size();
        if (outside > 0) log.warn("Upstream returned {} row(s) outside {}; dropped", outside, range);

        List<NormalizedRow> rows = new ArrayList<>((int) range.days());
        int filled = 0;
        for (LocalDate d = range.start(); !d.isAfter(range.end()); d = d.plusDays(1)) {
            NormalizedRow row = byDate.get(d);
            if (row == null) {
                row = zeroRow(d, requestedMetrics);
                filled++;
            }
            rows.add(row);
        }
        if (filled > 0) log.debug("Filled {} missing day(s) in {} with zeros", filled, range);
        return new NormalizedSeries(rows);
    }

    private TreeMap<LocalDate, NormalizedRow> parse(RawResponse raw, Collection<String> requestedMetrics) {
        int dateIndex = raw.dimensionHeaders().indexOf(MetricCatalog.DATE);
        if (dateIndex < 0) {
            throw new MalformedResponseException("response has no '" + MetricCatalog.DATE + "' dimension: "
                    + raw.dimensionHeaders());
        }
        Map<String, Integer> metricIndex = new LinkedHashMap<>();
        for (int i = 0; i < raw.metricHeaders().size(); i++) metricIndex.put(raw.metricHeaders().get(i), i);

        TreeMap<LocalDate, NormalizedRow> byDate = new TreeMap<>();
        int rowNo = 0;
        for (RawResponse.Row row : raw.rows()) {
            if (row.dimensionValues().size() != raw.dimensionHeaders().size()
                    || row.metricValues().size() != raw.metricHeaders().size()) {
                throw new MalformedResponseException("row " + rowNo + " has " + row.dimensionValues().size() + "/"
                        + row.metricValues().size() + " values for " + raw.dimensionHeaders().size() + "/"
                        + raw.metricHeaders().size() + " headers");
            }
            LocalDate date = parseDate(row.dimensionValues().get(dateIndex), rowNo);
            Map<String, Double> values = new LinkedHashMap<>();
            for (String metric : requestedMetrics) {
                Integer idx = metricIndex.get(metric);
                values.put(metric, idx == null ? 0.0 : parseNumber(row.metricValues().get(idx), metric, rowNo));
            }
            if (byDate.put(date, new NormalizedRow(date, values)) != null) {
                throw new MalformedResponseException("duplicate row for " + date);
            }
            rowNo++;
        }
        return byDate;
    }

    private static NormalizedRow zeroRow(LocalDate date, Collection<String> metrics) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String m : metrics) values.put(m, 0.0);
        return new NormalizedRow(date, values);
    }

    private static LocalDate parseDate(String value, int rowNo) {
        try {
            return LocalDate.parse(value, UPSTREAM_DATE);
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("row " + rowNo + ": bad date '" + value + "'", e);
        }
    }

    private static double parseNumber(String value, String metric, int rowNo) {
        if (value == null || value.isEmpty()) return 0.0;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("row " + rowNo + ": bad value '" + value + "' for " + metric, e);
        }
    }
}

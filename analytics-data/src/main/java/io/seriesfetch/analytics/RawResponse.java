package io.seriesfetch.analytics;

import java.util.List;

/**
 * One upstream report as returned: headers give names to row values by position.
 */
public record RawResponse(List<String> dimensionHeaders, List<String> metricHeaders, List<Row> rows) {
    public RawResponse {
        dimensionHeaders = List.copyOf(dimensionHeaders);
        metricHeaders = List.copyOf(metricHeaders);
        rows = List.copyOf(rows);
    }

    public record Row(List<String> dimensionValues, List<String> metricValues) {
        public Row {
            dimensionValues = List.copyOf(dimensionValues);
            metricValues = List.copyOf(metricValues);
        }
    }
}

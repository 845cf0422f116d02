package io.seriesfetch.analytics;

import io.seriesfetch.error.PipelineException;

/** A date range that is inverted or empty. Raised before any upstream call. */
public class InvalidRangeException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public InvalidRangeException(String message) {
        super(message);
    }
}

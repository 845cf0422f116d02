package io.seriesfetch.analytics;

import io.seriesfetch.error.PipelineException;

/** Unknown metric or dimension, malformed property id, or a request the upstream API refused as invalid. */
public class InvalidArgumentException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public InvalidArgumentException(String message) {
        super(message);
    }
}

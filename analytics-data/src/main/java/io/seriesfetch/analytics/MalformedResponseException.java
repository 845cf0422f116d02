package io.seriesfetch.analytics;

import io.seriesfetch.error.PipelineException;

/** An upstream response whose shape does not match its headers. Never retried, never dropped silently. */
public class MalformedResponseException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}

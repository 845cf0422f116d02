package io.seriesfetch.analytics;

import io.seriesfetch.error.PipelineException;

/** Missing credentials, or credentials rejected by the upstream API. */
public class AuthException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public AuthException(String message) {
        super(message);
    }
}

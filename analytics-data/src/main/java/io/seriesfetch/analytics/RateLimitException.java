package io.seriesfetch.analytics;

import io.seriesfetch.error.RetryableException;

/** Upstream signalled that the caller is over its rate limit. */
public class RateLimitException extends RetryableException {
    private static final long serialVersionUID = 1L;

    public RateLimitException(String message) {
        super(message);
    }
}

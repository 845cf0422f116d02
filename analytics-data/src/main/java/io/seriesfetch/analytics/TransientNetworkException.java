package io.seriesfetch.analytics;

import io.seriesfetch.error.RetryableException;

/** Upstream 5xx or an I/O failure talking to it. */
public class TransientNetworkException extends RetryableException {
    private static final long serialVersionUID = 1L;

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}

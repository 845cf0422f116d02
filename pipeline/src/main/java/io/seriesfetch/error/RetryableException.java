package io.seriesfetch.error;

/** Transient failure; the same call may succeed after a delay. */
public class RetryableException extends PipelineException {
    private static final long serialVersionUID = 1L;

    public RetryableException(String message) {
        super(message, null, true);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}

package io.seriesfetch.error;

/**
 * Root of the pipeline's failure taxonomy. Every failure carries whether retrying the same call may succeed.
 */
public class PipelineException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final boolean retryable;

    public PipelineException(String message) {
        this(message, null, false);
    }

    public PipelineException(String message, Throwable cause) {
        this(message, cause, false);
    }

    protected PipelineException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}

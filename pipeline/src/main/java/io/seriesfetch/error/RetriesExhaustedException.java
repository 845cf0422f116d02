package io.seriesfetch.error;

/** Raised once a retryable failure persisted past the attempt or total-wait cap. The cause is the last failure. */
public class RetriesExhaustedException extends PipelineException {
    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempt(s): " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }
}

package io.seriesfetch.error;

/**
 * The daily quota cannot accommodate the request. Waiting within the same UTC day does not help.
 */
public class QuotaExceededException extends PipelineException {
    private static final long serialVersionUID = 1L;

    private final long remainingRequests;
    private final long remainingTokens;

    public QuotaExceededException(String message, long remainingRequests, long remainingTokens) {
        super(message + " (remaining requests=" + remainingRequests + ", remaining tokens=" + remainingTokens + ")");
        this.remainingRequests = remainingRequests;
        this.remainingTokens = remainingTokens;
    }

    public long remainingRequests() { return remainingRequests; }
    public long remainingTokens() { return remainingTokens; }
}

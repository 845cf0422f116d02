package io.seriesfetch.retry;

/**
 * Decides whether and after how long a failed attempt is retried. Attempts are counted from 1.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);

    /** Delay before the attempt following {@code attempt}. */
    long backoffMillis(int attempt);

    /** Upper bound on the sum of all backoff delays for one call. */
    long maxTotalWaitMillis();
}

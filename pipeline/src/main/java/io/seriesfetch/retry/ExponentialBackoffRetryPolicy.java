package io.seriesfetch.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * {@code base * 2^(attempt-1) + jitter(base)}, capped per delay at {@code maxMillis}.
 * With the default jitter in {@code [0, base)} successive uncapped delays strictly increase.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_MILLIS = 1_000;
    public static final long DEFAULT_MAX_MILLIS = 32_000;
    public static final long DEFAULT_MAX_TOTAL_WAIT_MILLIS = 60_000;

    public static final LongUnaryOperator RANDOM_JITTER = base -> ThreadLocalRandom.current().nextLong(Math.max(1, base));
    public static final LongUnaryOperator NO_JITTER = base -> 0L;

    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final long maxTotalWaitMillis;
    private final LongUnaryOperator jitter;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, Long.MAX_VALUE, RANDOM_JITTER);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, long maxTotalWaitMillis,
                                         LongUnaryOperator jitter) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.maxTotalWaitMillis = Math.max(0, maxTotalWaitMillis);
        this.jitter = jitter == null ? NO_JITTER : jitter;
    }

    public static ExponentialBackoffRetryPolicy defaults() {
        return new ExponentialBackoffRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_MILLIS, DEFAULT_MAX_MILLIS,
                DEFAULT_MAX_TOTAL_WAIT_MILLIS, RANDOM_JITTER);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        long withJitter = delay + Math.max(0, jitter.applyAsLong(baseMillis));
        return Math.min(withJitter, maxMillis);
    }

    @Override
    public long maxTotalWaitMillis() { return maxTotalWaitMillis; }

    public int maxAttempts() { return maxAttempts; }
}

package io.seriesfetch.budget;

/**
 * Per-property quota ceilings enforced locally before calls reach the upstream API.
 */
public record QuotaLimits(int dailyRequests, long dailyTokens, long minuteTokens, int concurrency) {
    public static final int DEFAULT_DAILY_REQUESTS = 25_000;
    public static final long DEFAULT_DAILY_TOKENS = 1_000_000L;
    public static final long DEFAULT_MINUTE_TOKENS = 10_000L;
    public static final int DEFAULT_CONCURRENCY = 10;

    public QuotaLimits {
        if (dailyRequests <= 0 || dailyTokens <= 0 || minuteTokens <= 0 || concurrency <= 0) {
            throw new IllegalArgumentException("quota limits must be positive: " + dailyRequests + "/" + dailyTokens
                    + "/" + minuteTokens + "/" + concurrency);
        }
    }

    public static QuotaLimits defaults() {
        return new QuotaLimits(DEFAULT_DAILY_REQUESTS, DEFAULT_DAILY_TOKENS, DEFAULT_MINUTE_TOKENS, DEFAULT_CONCURRENCY);
    }
}

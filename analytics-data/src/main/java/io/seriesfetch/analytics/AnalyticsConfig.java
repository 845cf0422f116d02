package io.seriesfetch.analytics;

import io.seriesfetch.budget.QuotaLimits;
import io.seriesfetch.retry.ExponentialBackoffRetryPolicy;

import java.time.Duration;

public record AnalyticsConfig(
        String propertyId,
        String accessToken,
        String endpoint,
        int days,
        Duration cacheTtl,
        int concurrency,
        int dailyRequests,
        long dailyTokens,
        long minuteTokens,
        int retryMaxAttempts,
        long retryBaseMillis,
        long retryMaxTotalWaitMillis,
        Duration requestTimeout
) {
    public static final String DEFAULT_ENDPOINT = "https://analyticsdata.googleapis.com/v1beta";

    public static AnalyticsConfig fromEnv() {
        String propertyId = setting("seriesfetch.propertyId", "GA4_PROPERTY_ID", null);
        String token = setting("seriesfetch.accessToken", "GA4_ACCESS_TOKEN", null);
        String endpoint = setting("seriesfetch.endpoint", "GA4_ENDPOINT", DEFAULT_ENDPOINT);
        int days = Integer.parseInt(setting("seriesfetch.days", "GA4_DATE_RANGE_DAYS", "30"));
        long ttlMinutes = Long.parseLong(setting("seriesfetch.cacheTtlMinutes", "SERIESFETCH_CACHE_TTL_MINUTES", "180"));
        int concurrency = Integer.parseInt(setting("seriesfetch.concurrency", "SERIESFETCH_CONCURRENCY",
                String.valueOf(QuotaLimits.DEFAULT_CONCURRENCY)));
        int dailyRequests = Integer.parseInt(setting("seriesfetch.dailyRequests", "SERIESFETCH_DAILY_REQUESTS",
                String.valueOf(QuotaLimits.DEFAULT_DAILY_REQUESTS)));
        long dailyTokens = Long.parseLong(setting("seriesfetch.dailyTokens", "SERIESFETCH_DAILY_TOKENS",
                String.valueOf(QuotaLimits.DEFAULT_DAILY_TOKENS)));
        long minuteTokens = Long.parseLong(setting("seriesfetch.minuteTokens", "SERIESFETCH_MINUTE_TOKENS",
                String.valueOf(QuotaLimits.DEFAULT_MINUTE_TOKENS)));
        int maxAttempts = Integer.parseInt(setting("seriesfetch.retry.maxAttempts", "SERIESFETCH_RETRY_MAX_ATTEMPTS",
                String.valueOf(ExponentialBackoffRetryPolicy.DEFAULT_MAX_ATTEMPTS)));
        long baseMillis = Long.parseLong(setting("seriesfetch.retry.baseMillis", "SERIESFETCH_RETRY_BASE_MILLIS",
                String.valueOf(ExponentialBackoffRetryPolicy.DEFAULT_BASE_MILLIS)));
        long maxWait = Long.parseLong(setting("seriesfetch.retry.maxTotalWaitMillis", "SERIESFETCH_RETRY_MAX_TOTAL_WAIT_MILLIS",
                String.valueOf(ExponentialBackoffRetryPolicy.DEFAULT_MAX_TOTAL_WAIT_MILLIS)));
        long timeoutSeconds = Long.parseLong(setting("seriesfetch.requestTimeoutSeconds", "SERIESFETCH_REQUEST_TIMEOUT_SECONDS", "30"));
        return new AnalyticsConfig(propertyId, token, endpoint, days, Duration.ofMinutes(ttlMinutes), concurrency,
                dailyRequests, dailyTokens, minuteTokens, maxAttempts, baseMillis, maxWait, Duration.ofSeconds(timeoutSeconds));
    }

    public AnalyticsConfig withPropertyId(String id) {
        return new AnalyticsConfig(id, accessToken, endpoint, days, cacheTtl, concurrency, dailyRequests, dailyTokens,
                minuteTokens, retryMaxAttempts, retryBaseMillis, retryMaxTotalWaitMillis, requestTimeout);
    }

    public QuotaLimits quotaLimits() {
        return new QuotaLimits(dailyRequests, dailyTokens, minuteTokens, concurrency);
    }

    public ExponentialBackoffRetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(retryMaxAttempts, retryBaseMillis,
                ExponentialBackoffRetryPolicy.DEFAULT_MAX_MILLIS, retryMaxTotalWaitMillis,
                ExponentialBackoffRetryPolicy.RANDOM_JITTER);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}

package io.seriesfetch.analytics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsConfigTest {
    @AfterEach
    void clear() {
        System.clearProperty("seriesfetch.propertyId");
        System.clearProperty("seriesfetch.days");
        System.clearProperty("seriesfetch.cacheTtlMinutes");
        System.clearProperty("seriesfetch.minuteTokens");
        System.clearProperty("seriesfetch.retry.maxAttempts");
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("seriesfetch.propertyId", "555");
        System.setProperty("seriesfetch.days", "7");
        System.setProperty("seriesfetch.cacheTtlMinutes", "15");
        System.setProperty("seriesfetch.minuteTokens", "500");
        System.setProperty("seriesfetch.retry.maxAttempts", "2");

        AnalyticsConfig c = AnalyticsConfig.fromEnv();

        assertEquals("555", c.propertyId());
        assertEquals(7, c.days());
        assertEquals(Duration.ofMinutes(15), c.cacheTtl());
        assertEquals(500, c.quotaLimits().minuteTokens());
        assertEquals(2, c.retryPolicy().maxAttempts());
    }

    @Test
    void quotaAndRetryDefaultsMatchUpstreamLimits() {
        AnalyticsConfig c = AnalyticsConfig.fromEnv();
        if (System.getenv("SERIESFETCH_DAILY_REQUESTS") == null) assertEquals(25_000, c.quotaLimits().dailyRequests());
        if (System.getenv("SERIESFETCH_CONCURRENCY") == null) assertEquals(10, c.quotaLimits().concurrency());
        if (System.getenv("GA4_ENDPOINT") == null) assertEquals(AnalyticsConfig.DEFAULT_ENDPOINT, c.endpoint());
    }

    @Test
    void withPropertyIdKeepsEverythingElse() {
        AnalyticsConfig c = AnalyticsConfig.fromEnv();
        AnalyticsConfig d = c.withPropertyId("777");
        assertEquals("777", d.propertyId());
        assertEquals(c.cacheTtl(), d.cacheTtl());
        assertEquals(c.quotaLimits(), d.quotaLimits());
    }
}

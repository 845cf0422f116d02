package io.seriesfetch.analytics;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {
    private static final DateRange JAN = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

    @Test
    void metricOrderDoesNotChangeKey() {
        CacheKey a = CacheKey.of("123", MetricRequest.of(List.of("totalUsers", "activeUsers"), List.of("date")), JAN, Granularity.DAILY);
        CacheKey b = CacheKey.of("123", MetricRequest.of(List.of("activeUsers", "totalUsers", "activeUsers"), List.of("date")), JAN, Granularity.DAILY);

        assertEquals(a, b);
        assertEquals("123:activeUsers,totalUsers:date:2024-01-01:2024-01-31:DAILY", a.asString());
    }

    @Test
    void distinctInputsGiveDistinctKeys() {
        MetricRequest users = MetricRequest.of(List.of("totalUsers"), List.of("date"));
        String base = CacheKey.of("123", users, JAN, Granularity.DAILY).asString();

        assertNotEquals(base, CacheKey.of("1234", users, JAN, Granularity.DAILY).asString());
        assertNotEquals(base, CacheKey.of("123", MetricRequest.of(List.of("newUsers"), List.of("date")), JAN, Granularity.DAILY).asString());
        assertNotEquals(base, CacheKey.of("123", users, new DateRange(JAN.start(), JAN.end().plusDays(1)), Granularity.DAILY).asString());
        assertNotEquals(base, CacheKey.of("123", users, JAN, Granularity.WEEKLY).asString());
    }

    @Test
    void requestValidationRejectsUnknownNames() {
        assertThrows(InvalidArgumentException.class, () -> MetricRequest.of(List.of(), List.of("date")));
        assertThrows(InvalidArgumentException.class, () -> MetricRequest.of(List.of("bounceRate"), List.of("date")));
        assertThrows(InvalidArgumentException.class, () -> MetricRequest.of(List.of("totalUsers"), List.of()));
        assertThrows(InvalidArgumentException.class, () -> MetricRequest.of(List.of("totalUsers"), List.of("date", "country")));
    }

    @Test
    void propertyIdMustBeNumeric() {
        assertEquals("987654321", MetricCatalog.requirePropertyId("987654321"));
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> MetricCatalog.requirePropertyId("G-ABC123"));
        assertTrue(e.getMessage().contains("measurement id"));
        assertThrows(InvalidArgumentException.class, () -> MetricCatalog.requirePropertyId(""));
        assertThrows(InvalidArgumentException.class, () -> MetricCatalog.requirePropertyId(null));
    }
}

package io.seriesfetch.analytics;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.TypeLiteral;
import com.google.inject.util.Modules;
import io.seriesfetch.budget.Budget;
import io.seriesfetch.budget.QuotaGovernor;
import io.seriesfetch.cache.CacheStore;
import io.seriesfetch.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsModuleTest {
    static AnalyticsConfig config(String propertyId) {
        return new AnalyticsConfig(propertyId, "token", "http://127.0.0.1:1/v1beta", 5, Duration.ofMinutes(30),
                3, 100, 50_000, 5_000, 2, 1, 10, Duration.ofSeconds(2));
    }

    static Module withFakes(AnalyticsConfig config, AnalyticsTransport transport, Clock clock) {
        return Modules.override(new AnalyticsModule(config)).with(binder -> {
            binder.bind(AnalyticsTransport.class).toInstance(transport);
            binder.bind(Clock.class).toInstance(clock);
        });
    }

    @Test
    void wiresSharedComponentsFromConfig() {
        Injector injector = Guice.createInjector(new AnalyticsModule(config("42")));

        QuotaGovernor governor = (QuotaGovernor) injector.getInstance(Budget.class);
        assertEquals(100, governor.limits().dailyRequests());
        assertEquals(3, governor.limits().concurrency());
        assertSame(governor, injector.getInstance(Budget.class));

        CacheStore<NormalizedSeries> cache = injector.getInstance(Key.get(new TypeLiteral<CacheStore<NormalizedSeries>>() {}));
        assertEquals(Duration.ofMinutes(30), cache.defaultTtl());
        assertInstanceOf(HttpAnalyticsTransport.class, injector.getInstance(AnalyticsTransport.class));

        PipelineOrchestrator o = injector.getInstance(PipelineOrchestrator.class);
        try {
            assertEquals("42", o.propertyId());
            assertSame(o, injector.getInstance(PipelineOrchestrator.class));
        } finally {
            o.close();
        }
    }

    @Test
    void fetchThroughInjectedPipelineRecordsMetrics() throws Exception {
        ScriptedTransport transport = new ScriptedTransport();
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        Injector injector = Guice.createInjector(withFakes(config("42"), transport, clock));
        PipelineOrchestrator o = injector.getInstance(PipelineOrchestrator.class);
        try {
            NormalizedSeries s = o.fetchDailyUsers(5);
            o.fetchDailyUsers(5);

            assertEquals(LocalDate.of(2024, 3, 14), s.rows().get(4).date());
            Metrics metrics = injector.getInstance(Metrics.class);
            assertEquals(1, metrics.count("analytics.fetch.subrequests"));
            assertEquals(1, metrics.count("cache.hits"));
            assertEquals(2, metrics.count("analytics.fetch.requests"));
        } finally {
            o.close();
        }
    }
}

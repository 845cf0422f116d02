package io.seriesfetch.analytics;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.seriesfetch.budget.Budget;
import io.seriesfetch.budget.QuotaGovernor;
import io.seriesfetch.cache.CacheStore;
import io.seriesfetch.cache.InMemoryCacheBackend;
import io.seriesfetch.metrics.Metrics;
import io.seriesfetch.retry.FailureClassifier;
import io.seriesfetch.retry.RetryExecutor;
import io.seriesfetch.retry.Sleeper;

import java.time.Clock;

public class AnalyticsModule extends AbstractModule {
    private final AnalyticsConfig config;

    public AnalyticsModule(AnalyticsConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(AnalyticsConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton CredentialProvider credentials() { return new EnvCredentialProvider(config.accessToken()); }

    @Provides @Singleton AnalyticsTransport transport(CredentialProvider credentials) {
        return new HttpAnalyticsTransport(config.endpoint(), credentials, config.requestTimeout());
    }

    @Provides @Singleton Budget budget(Clock clock, Metrics metrics) {
        return new QuotaGovernor(config.quotaLimits(), clock, metrics);
    }

    @Provides @Singleton RetryExecutor retry(Metrics metrics) {
        return new RetryExecutor(config.retryPolicy(), FailureClassifier.DEFAULT, Sleeper.THREAD, metrics);
    }

    @Provides @Singleton CacheStore<NormalizedSeries> cache(Clock clock, Metrics metrics) {
        return new CacheStore<>(new InMemoryCacheBackend<>(), clock, config.cacheTtl(), metrics);
    }

    @Provides @Singleton PipelineOrchestrator orchestrator(AnalyticsTransport transport, Budget budget, RetryExecutor retry,
                                                           CacheStore<NormalizedSeries> cache, Clock clock, MetricRegistry registry) {
        return PipelineOrchestrator.builder()
                .transport(transport)
                .propertyId(config.propertyId())
                .budget(budget)
                .retry(retry)
                .cache(cache)
                .clock(clock)
                .cacheTtl(config.cacheTtl())
                .workers(config.concurrency())
                .metrics(registry)
                .build();
    }

    @Provides @Singleton AnalyticsReportService reportService(PipelineOrchestrator orchestrator, Clock clock) {
        return new AnalyticsReportService(orchestrator, config.propertyId(), clock);
    }
}

package io.seriesfetch.analytics;

import com.codahale.metrics.MetricRegistry;
import io.seriesfetch.budget.Budget;
import io.seriesfetch.budget.QuotaGovernor;
import io.seriesfetch.budget.QuotaLimits;
import io.seriesfetch.cache.CacheStore;
import io.seriesfetch.cache.InMemoryCacheBackend;
import io.seriesfetch.metrics.Metrics;
import io.seriesfetch.retry.ExponentialBackoffRetryPolicy;
import io.seriesfetch.retry.FailureClassifier;
import io.seriesfetch.retry.RetryExecutor;
import io.seriesfetch.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class OrchestratorBuilder {
    private AnalyticsTransport transport;
    private String propertyId;
    private Budget budget;
    private RetryExecutor retry;
    private CacheStore<NormalizedSeries> cache;
    private RangeSplitter splitter = new RangeSplitter();
    private ResponseNormalizer normalizer = new ResponseNormalizer();
    private Clock clock = Clock.systemUTC();
    private Duration cacheTtl = CacheStore.DEFAULT_TTL;
    private int workers = QuotaLimits.DEFAULT_CONCURRENCY;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public OrchestratorBuilder transport(AnalyticsTransport t) { this.transport = t; return this; }
    public OrchestratorBuilder propertyId(String id) { this.propertyId = id; return this; }
    public OrchestratorBuilder budget(Budget b) { this.budget = b; return this; }
    public OrchestratorBuilder retry(RetryExecutor r) { this.retry = r; return this; }
    public OrchestratorBuilder cache(CacheStore<NormalizedSeries> c) { this.cache = c; return this; }
    public OrchestratorBuilder splitter(RangeSplitter s) { this.splitter = s; return this; }
    public OrchestratorBuilder normalizer(ResponseNormalizer n) { this.normalizer = n; return this; }
    public OrchestratorBuilder clock(Clock c) { this.clock = c; return this; }
    public OrchestratorBuilder cacheTtl(Duration ttl) { this.cacheTtl = ttl; return this; }
    public OrchestratorBuilder workers(int w) { this.workers = Math.max(1, w); return this; }
    public OrchestratorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public PipelineOrchestrator build() {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(splitter, "splitter");
        Objects.requireNonNull(normalizer, "normalizer");
        Objects.requireNonNull(clock, "clock");
        Metrics metrics = new Metrics(metricRegistry);
        Budget b = budget != null ? budget : new QuotaGovernor(QuotaLimits.defaults(), clock, metrics);
        RetryExecutor r = retry != null ? retry
                : new RetryExecutor(ExponentialBackoffRetryPolicy.defaults(), FailureClassifier.DEFAULT, Sleeper.THREAD, metrics);
        CacheStore<NormalizedSeries> c = cache != null ? cache
                : new CacheStore<>(new InMemoryCacheBackend<>(), clock, cacheTtl, metrics);
        return new PipelineOrchestrator(transport, propertyId, b, r, c, splitter, normalizer, clock, cacheTtl, workers, metrics);
    }
}

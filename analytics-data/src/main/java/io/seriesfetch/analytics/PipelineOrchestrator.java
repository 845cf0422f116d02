package io.seriesfetch.analytics;

import com.codahale.metrics.Timer;
import io.seriesfetch.budget.Budget;
import io.seriesfetch.budget.QuotaGovernor;
import io.seriesfetch.cache.CacheStore;
import io.seriesfetch.core.Sequenced;
import io.seriesfetch.error.Failures;
import io.seriesfetch.metrics.Metrics;
import io.seriesfetch.retry.RetryExecutor;
import io.seriesfetch.runtime.OrderedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The public fetch path: cache lookup, range split, quota-governed concurrent sub-requests with retry,
 * normalization, and an ordered merge.
 *
 * <p>A fetch either returns the complete series for the requested range or throws. When one sub-request fails the
 * rest are cancelled, finished parts are discarded and nothing is cached.
 */
public class PipelineOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final List<String> DAILY_USERS_METRICS = List.of(MetricCatalog.TOTAL_USERS, MetricCatalog.ACTIVE_USERS);
    static final List<String> DAILY_REVENUE_METRICS = List.of(MetricCatalog.TOTAL_REVENUE, MetricCatalog.PURCHASE_REVENUE);
    static final List<String> DATE_ONLY = List.of(MetricCatalog.DATE);

    private final AnalyticsTransport transport;
    private final String propertyId;
    private final Budget budget;
    private final RetryExecutor retry;
    private final CacheStore<NormalizedSeries> cache;
    private final RangeSplitter splitter;
    private final ResponseNormalizer normalizer;
    private final Clock clock;
    private final Duration cacheTtl;
    private final Metrics metrics;
    private final ExecutorService workers;

    PipelineOrchestrator(AnalyticsTransport transport, String propertyId, Budget budget, RetryExecutor retry,
                         CacheStore<NormalizedSeries> cache, RangeSplitter splitter, ResponseNormalizer normalizer,
                         Clock clock, Duration cacheTtl, int workerCount, Metrics metrics) {
        this.transport = transport;
        this.propertyId = propertyId;
        this.budget = budget;
        this.retry = retry;
        this.cache = cache;
        this.splitter = splitter;
        this.normalizer = normalizer;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
        this.metrics = metrics;
        this.workers = Executors.newFixedThreadPool(workerCount, namedDaemonThreads("analytics-fetch"));
    }

    public static OrchestratorBuilder builder() { return new OrchestratorBuilder(); }

    public String propertyId() { return propertyId; }

    public Clock clock() { return clock; }

    public NormalizedSeries fetch(String propertyId, List<String> metricNames, List<String> dimensions,
                                  LocalDate start, LocalDate end) throws InterruptedException {
        return fetch(propertyId, metricNames, dimensions, new DateRange(start, end));
    }

    public NormalizedSeries fetch(String propertyId, List<String> metricNames, List<String> dimensions,
                                  DateRange range) throws InterruptedException {
        MetricCatalog.requirePropertyId(propertyId);
        MetricRequest request = MetricRequest.of(metricNames, dimensions);
        CacheKey key = CacheKey.of(propertyId, request, range, splitter.granularityFor(range));
        metrics.counter("analytics.fetch.requests").inc();
        try (Timer.Context ignored = metrics.timer("analytics.fetch.time").time()) {
            return cache.getOrFetch(key.asString(), cacheTtl, () -> fetchUncached(propertyId, request, range));
        } catch (RuntimeException | InterruptedException e) {
            metrics.counter("analytics.fetch.failures").inc();
            throw e;
        }
    }

    /** Drops any cached entry for the request, then fetches it again. */
    public NormalizedSeries refresh(String propertyId, List<String> metricNames, List<String> dimensions,
                                    DateRange range) throws InterruptedException {
        MetricCatalog.requirePropertyId(propertyId);
        MetricRequest request = MetricRequest.of(metricNames, dimensions);
        cache.invalidate(CacheKey.of(propertyId, request, range, splitter.granularityFor(range)).asString());
        return fetch(propertyId, metricNames, dimensions, range);
    }

    /** Total and active users per day for the {@code days} days ending yesterday. */
    public NormalizedSeries fetchDailyUsers(int days) throws InterruptedException {
        return fetch(requireDefaultPropertyId(), DAILY_USERS_METRICS, DATE_ONLY, DateRanges.lastDays(days, clock));
    }

    public NormalizedSeries fetchDailyRevenue(int days) throws InterruptedException {
        return fetchDailyRevenue(DateRanges.lastDays(days, clock));
    }

    /** Total and purchase revenue per day, plus {@code adRevenue = max(0, total - purchase)}. */
    public NormalizedSeries fetchDailyRevenue(DateRange range) throws InterruptedException {
        NormalizedSeries revenue = fetch(requireDefaultPropertyId(), DAILY_REVENUE_METRICS, DATE_ONLY, range);
        return revenue.withDerived(MetricCatalog.AD_REVENUE, PipelineOrchestrator::adRevenue);
    }

    static double adRevenue(NormalizedRow row) {
        return Math.max(0.0, row.value(MetricCatalog.TOTAL_REVENUE) - row.value(MetricCatalog.PURCHASE_REVENUE));
    }

    private String requireDefaultPropertyId() {
        if (propertyId == null) throw new InvalidArgumentException("no default property id configured");
        return propertyId;
    }

    private NormalizedSeries fetchUncached(String propertyId, MetricRequest request, DateRange range)
            throws InterruptedException {
        QueryPlan plan = splitter.plan(range);
        CompletionService<Sequenced<NormalizedSeries>> completion = new ExecutorCompletionService<>(workers);
        List<Future<Sequenced<NormalizedSeries>>> futures = new ArrayList<>(plan.size());
        for (QueryPlan.Step step : plan.steps()) {
            futures.add(completion.submit(() -> runStep(propertyId, request, step)));
        }

        OrderedBuffer<NormalizedSeries> ordered = new OrderedBuffer<>(0);
        List<NormalizedSeries> parts = new ArrayList<>(plan.size());
        try {
            for (int done = 0; done < plan.size(); done++) {
                Future<Sequenced<NormalizedSeries>> next = completion.take();
                ordered.add(next.get());
                parts.addAll(ordered.drainReady());
            }
        } catch (ExecutionException e) {
            Throwable cause = Failures.unwrap(e);
            log.warn("Sub-request for {} failed ({}); cancelling {} sibling(s)", range, cause.toString(), plan.size() - 1);
            cancelAll(futures);
            throw Failures.propagate(cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        }

        NormalizedSeries merged = NormalizedSeries.concat(parts);
        if (!merged.coversDaily(range)) {
            throw new MalformedResponseException("merged series " + merged + " does not cover " + range + " day by day");
        }
        return merged;
    }

    private Sequenced<NormalizedSeries> runStep(String propertyId, MetricRequest request, QueryPlan.Step step)
            throws InterruptedException {
        DateRange r = step.range();
        long cost = QuotaGovernor.estimateCost(request.metrics().size(), request.dimensions().size(),
                step.granularity().expectedRows(r));
        Budget.Permit permit = budget.admit(cost);
        RawResponse raw;
        try {
            metrics.counter("analytics.fetch.subrequests").inc();
            raw = retry.execute("runReport " + r, () ->
                    transport.call(propertyId, request.metrics(), request.dimensions(), r.start(), r.end()));
        } catch (RuntimeException | InterruptedException e) {
            budget.release(permit);
            throw e;
        }
        budget.complete(permit);
        return new Sequenced<>(step.index(), normalizer.normalize(raw, request.metrics(), r));
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) f.cancel(true);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

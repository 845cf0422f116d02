package io.seriesfetch.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a Dropwizard registry shared by the budget, retry, cache and orchestration layers.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry == null ? new MetricRegistry() : registry;
    }

    /** Metrics backed by a private registry, for components constructed without one. */
    public static Metrics detached() { return new Metrics(new MetricRegistry()); }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public long count(String counterName) { return registry.counter(counterName).getCount(); }
}

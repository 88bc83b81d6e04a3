package io.parareq.metrics;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.function.Supplier;

public class Metrics {
    public static final String ADMITTED = "dispatch.admitted.rate";
    public static final String SUCCEEDED = "dispatch.succeeded.rate";
    public static final String FAILED = "dispatch.failed.rate";
    public static final String RETRIED = "dispatch.retried.rate";
    public static final String RATE_LIMITED = "dispatch.ratelimited.rate";
    public static final String CALL_TIME = "dispatch.call.time";
    public static final String RETRY_DEPTH = "dispatch.retry.depth";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Registers the gauge, replacing one left over from an earlier run on the same registry. */
    public <T> void gauge(String name, Supplier<T> value) {
        registry.remove(name);
        registry.register(name, (Gauge<T>) value::get);
    }
}

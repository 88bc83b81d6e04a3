package io.parareq.runtime;

import com.codahale.metrics.MetricRegistry;
import io.parareq.budget.Budget;
import io.parareq.budget.DualBucketBudget;
import io.parareq.budget.RateBucket;
import io.parareq.config.DispatchConfig;
import io.parareq.core.CostEstimator;
import io.parareq.core.RawJob;
import io.parareq.core.Source;
import io.parareq.core.Transport;
import io.parareq.metrics.Metrics;
import io.parareq.retry.AttemptBudgetRetryPolicy;
import io.parareq.retry.RetryPolicy;
import io.parareq.sink.ResultSink;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public class AdmissionLoopBuilder {
    private Source<RawJob> source;
    private Transport transport;
    private ResultSink sink;
    private CostEstimator costEstimator = CostEstimator.ZERO;
    private DispatchConfig config = DispatchConfig.defaults();
    private RetryPolicy retryPolicy = new AttemptBudgetRetryPolicy();
    private Budget budget;
    private Clock clock = Clock.systemUTC();
    private MetricRegistry metricRegistry = new MetricRegistry();

    public AdmissionLoopBuilder source(Source<RawJob> s) { this.source = s; return this; }
    public AdmissionLoopBuilder transport(Transport t) { this.transport = t; return this; }
    public AdmissionLoopBuilder sink(ResultSink s) { this.sink = s; return this; }
    public AdmissionLoopBuilder costEstimator(CostEstimator e) { this.costEstimator = e; return this; }
    public AdmissionLoopBuilder config(DispatchConfig c) { this.config = c; return this; }
    public AdmissionLoopBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    /** Overrides the budget derived from the config's limits. */
    public AdmissionLoopBuilder budget(Budget b) { this.budget = b; return this; }
    public AdmissionLoopBuilder clock(Clock c) { this.clock = c; return this; }
    public AdmissionLoopBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public AdmissionLoop build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(costEstimator, "costEstimator");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(clock, "clock");
        DispatchConfig cfg = Objects.requireNonNull(config, "config").validate();
        Budget b = budget != null ? budget : budgetFor(cfg, clock.instant());
        return new AdmissionLoop(source, costEstimator, b, transport, new ResponseClassifier(cfg.rateLimitSignature()),
                retryPolicy, sink, clock, new Metrics(metricRegistry), cfg.maxAttempts(), cfg.loopSleep(), cfg.cooldown(),
                cfg.reportInterval());
    }

    public static DualBucketBudget budgetFor(DispatchConfig cfg, Instant now) {
        return new DualBucketBudget(
                new RateBucket(cfg.requestLimit(), cfg.requestPeriod(), now),
                new RateBucket(cfg.costLimit(), cfg.costPeriod(), now));
    }
}

package io.parareq.runtime;

import com.codahale.metrics.Meter;
import io.parareq.budget.Budget;
import io.parareq.core.CostEstimator;
import io.parareq.core.Failure;
import io.parareq.core.FailureKind;
import io.parareq.core.Job;
import io.parareq.core.RawJob;
import io.parareq.core.Source;
import io.parareq.core.Transport;
import io.parareq.error.MalformedInputException;
import io.parareq.metrics.Metrics;
import io.parareq.retry.RetryPolicy;
import io.parareq.sink.ResultSink;
import io.parareq.source.RetryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler for one batch run. Pulls the next job (retry queue first, then the source), refills the
 * budget, and launches a dispatch when the budget can pay for it. After each iteration it sleeps
 * briefly, and pauses new admissions for the cooldown window after a rate-limit rejection.
 * <p>
 * Everything runs on a single "admission-loop" thread: loop iterations, dispatch outcome handlers and
 * progress reports. The only suspension points are an outstanding outbound call, the per-iteration
 * sleep and the cooldown sleep, all of them scheduled rather than blocking.
 * At most one job is held waiting for capacity, so memory stays flat however large the input.
 */
public class AdmissionLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdmissionLoop.class);

    private final Source<RawJob> source;
    private final CostEstimator costEstimator;
    private final Budget budget;
    private final RetryQueue retryQueue;
    private final StatusTracker status;
    private final Dispatcher dispatcher;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration loopSleep;
    private final Duration cooldown;
    private final Duration reportInterval;
    private final Meter admittedMeter;
    private final ProgressReporter reporter;

    private final ScheduledExecutorService scheduler;
    private final CompletableFuture<StatusSnapshot> done = new CompletableFuture<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile AdmissionState state = AdmissionState.FETCHING;
    private Job held;
    private long nextId = 0;
    private ScheduledFuture<?> reporting;

    AdmissionLoop(Source<RawJob> source,
                  CostEstimator costEstimator,
                  Budget budget,
                  Transport transport,
                  ResponseClassifier classifier,
                  RetryPolicy retryPolicy,
                  ResultSink sink,
                  Clock clock,
                  Metrics metrics,
                  int maxAttempts,
                  Duration loopSleep,
                  Duration cooldown,
                  Duration reportInterval) {
        this.source = Objects.requireNonNull(source, "source");
        this.costEstimator = Objects.requireNonNull(costEstimator, "costEstimator");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAttempts = maxAttempts;
        this.loopSleep = loopSleep;
        this.cooldown = cooldown;
        this.reportInterval = reportInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "admission-loop");
            t.setDaemon(true);
            return t;
        });
        this.retryQueue = new RetryQueue();
        this.status = new StatusTracker();
        this.dispatcher = new Dispatcher(transport, classifier, retryPolicy, retryQueue, status, Objects.requireNonNull(sink, "sink"), clock,
                scheduler, metrics, this::abort);
        this.admittedMeter = metrics.meter(Metrics.ADMITTED);
        this.reporter = new ProgressReporter(status, retryQueue, metrics);
        metrics.gauge(Metrics.RETRY_DEPTH, retryQueue::size);
    }

    /** Start the loop. The returned future completes with the final counters once every job is terminal. */
    public CompletableFuture<StatusSnapshot> start() {
        if (!running.compareAndSet(false, true)) return done;
        log.debug("Entering admission loop");
        if (!reportInterval.isZero()) {
            long every = reportInterval.toNanos();
            reporting = scheduler.scheduleAtFixedRate(reporter, every, every, TimeUnit.NANOSECONDS);
        }
        scheduler.execute(this::iterate);
        return done;
    }

    /** Run to completion on the loop thread and wait for it. */
    public StatusSnapshot run() throws InterruptedException, ExecutionException {
        return start().get();
    }

    public AdmissionState state() { return state; }

    private void iterate() {
        if (done.isDone()) return;
        try {
            state = AdmissionState.FETCHING;
            if (held == null) held = fetch();

            budget.refill(clock.instant());

            if (held != null) {
                state = AdmissionState.CAPACITY_CHECK;
                if (budget.tryAcquire(held.cost())) {
                    state = AdmissionState.DISPATCH;
                    Job job = held;
                    held = null;
                    job.beginAttempt();
                    admittedMeter.mark();
                    dispatcher.dispatch(job);
                }
            }

            if (isComplete()) {
                drain();
                return;
            }
            state = AdmissionState.WAIT;
            scheduler.schedule(this::afterWait, loopSleep.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            abort(e);
        }
    }

    /** Runs after every micro-sleep, and again after every cooldown sleep, before the next iteration. */
    private void afterWait() {
        if (done.isDone()) return;
        try {
            Optional<Instant> lastRateLimit = status.lastRateLimitErrorTime();
            if (lastRateLimit.isPresent()) {
                Instant resumeAt = lastRateLimit.get().plus(cooldown);
                Duration remaining = Duration.between(clock.instant(), resumeAt);
                if (!remaining.isNegative() && !remaining.isZero()) {
                    state = AdmissionState.COOLDOWN;
                    log.warn("Pausing to cool down until {}", resumeAt);
                    // re-check on wake: a rejection that lands during the pause extends it
                    scheduler.schedule(this::afterWait, remaining.toNanos(), TimeUnit.NANOSECONDS);
                    return;
                }
            }
        } catch (RuntimeException e) {
            abort(e);
            return;
        }
        iterate();
    }

    private Job fetch() {
        Optional<Job> retry = retryQueue.poll();
        if (retry.isPresent()) {
            log.debug("Retrying request #{}", retry.get().id());
            return retry.get();
        }
        if (source.isFinished()) return null;
        Optional<RawJob> raw = source.poll();
        if (raw.isEmpty()) {
            log.debug("Input exhausted after {} jobs", nextId);
            return null;
        }
        Job job = newJob(raw.get());
        status.jobStarted();
        log.debug("Reading request #{} from line {}", job.id(), raw.get().line());
        if (!budget.admissible(job.cost())) {
            dispatcher.reject(job, new Failure(FailureKind.UNADMISSIBLE,
                    "cost " + job.cost() + " exceeds the cost limit", 0, clock.instant(), null));
            return null;
        }
        return job;
    }

    private Job newJob(RawJob raw) {
        double cost;
        try {
            cost = costEstimator.estimate(raw.payload());
        } catch (RuntimeException e) {
            throw new MalformedInputException(source.name(), raw.line(), "cannot estimate cost: " + e.getMessage(), e);
        }
        if (!(cost >= 0)) {
            throw new MalformedInputException(source.name(), raw.line(), "estimated cost is " + cost, null);
        }
        return new Job(nextId++, raw.payload(), raw.metadata(), cost, maxAttempts);
    }

    private boolean isComplete() {
        return held == null && retryQueue.isEmpty() && source.isFinished() && status.inProgress() == 0;
    }

    private void drain() {
        state = AdmissionState.DRAINED;
        stopReporting();
        reporter.run();
        source.close();
        StatusSnapshot snapshot = status.snapshot();
        log.info("Parallel processing complete: {} succeeded, {} failed", snapshot.succeeded(), snapshot.failed());
        done.complete(snapshot);
        scheduler.shutdown();
    }

    private void abort(Throwable cause) {
        if (done.isDone()) return;
        log.error("Run aborted: {}", cause.getMessage());
        stopReporting();
        source.close();
        done.completeExceptionally(cause);
        scheduler.shutdownNow();
    }

    private void stopReporting() {
        if (reporting != null) reporting.cancel(false);
    }

    /** Cancels an unfinished run; in-flight outcomes are dropped. */
    @Override
    public void close() {
        if (!done.isDone()) {
            scheduler.execute(() -> abort(new CancellationException("admission loop closed")));
        }
        scheduler.shutdown();
    }
}

package io.parareq.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.JsonNode;
import io.parareq.core.Failure;
import io.parareq.core.FailureKind;
import io.parareq.core.Job;
import io.parareq.core.Transport;
import io.parareq.metrics.Metrics;
import io.parareq.retry.RetryPolicy;
import io.parareq.sink.ResultSink;
import io.parareq.source.RetryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Issues one attempt for an admitted job and handles its outcome: a success or an exhausted job is
 * written to the result sink exactly once, anything else goes back on the retry queue.
 * <p>
 * The call itself runs wherever the transport runs it; the outcome handler is always hopped back onto
 * the loop executor, so status, queue and sink are only touched from the loop thread.
 */
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final Transport transport;
    private final ResponseClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final RetryQueue retryQueue;
    private final StatusTracker status;
    private final ResultSink sink;
    private final Clock clock;
    private final Executor loopExecutor;
    private final Consumer<Throwable> onFatal;

    private final Timer callTimer;
    private final Meter succeededMeter;
    private final Meter failedMeter;
    private final Meter retriedMeter;
    private final Meter rateLimitedMeter;

    public Dispatcher(Transport transport,
                      ResponseClassifier classifier,
                      RetryPolicy retryPolicy,
                      RetryQueue retryQueue,
                      StatusTracker status,
                      ResultSink sink,
                      Clock clock,
                      Executor loopExecutor,
                      Metrics metrics,
                      Consumer<Throwable> onFatal) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.retryQueue = Objects.requireNonNull(retryQueue, "retryQueue");
        this.status = Objects.requireNonNull(status, "status");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.loopExecutor = Objects.requireNonNull(loopExecutor, "loopExecutor");
        this.onFatal = Objects.requireNonNull(onFatal, "onFatal");
        this.callTimer = metrics.timer(Metrics.CALL_TIME);
        this.succeededMeter = metrics.meter(Metrics.SUCCEEDED);
        this.failedMeter = metrics.meter(Metrics.FAILED);
        this.retriedMeter = metrics.meter(Metrics.RETRIED);
        this.rateLimitedMeter = metrics.meter(Metrics.RATE_LIMITED);
    }

    /**
     * Launch one attempt without waiting for it. The attempt must already be counted on the job.
     * Returns the stage that completes once the outcome has been handled.
     */
    public CompletableFuture<Void> dispatch(Job job) {
        log.debug("Starting request #{} (attempt {})", job.id(), job.attemptsMade());
        Timer.Context timing = callTimer.time();
        CompletionStage<JsonNode> call;
        try {
            call = transport.send(job.payload());
            if (call == null) call = CompletableFuture.failedFuture(new IllegalStateException("transport returned no response"));
        } catch (Exception e) {
            call = CompletableFuture.failedFuture(e);
        }
        // suspension point: the loop keeps running while the call is outstanding
        return call.toCompletableFuture().handleAsync((response, error) -> {
            timing.stop();
            complete(job, response, error);
            return null;
        }, loopExecutor);
    }

    /** Finalize a job that can never be admitted without dispatching it. */
    public void reject(Job job, Failure failure) {
        job.recordFailure(failure);
        job.exhaust();
        log.error("Request #{} cannot be dispatched: {}", job.id(), failure.message());
        finishFailed(job);
    }

    private void complete(Job job, JsonNode response, Throwable error) {
        if (error != null) {
            Throwable cause = unwrap(error);
            fail(job, new Failure(FailureKind.TRANSPORT, describe(cause), job.attemptsMade(), clock.instant(), null));
            return;
        }
        var failure = classifier.classify(response, job.attemptsMade(), clock.instant());
        if (failure.isPresent()) {
            fail(job, failure.get());
            return;
        }
        try {
            sink.success(job, response);
        } catch (IOException e) {
            onFatal.accept(e);
            return;
        }
        status.jobSucceeded();
        succeededMeter.mark();
        log.debug("Request #{} saved", job.id());
    }

    private void fail(Job job, Failure failure) {
        job.recordFailure(failure);
        switch (failure.kind()) {
            case RATE_LIMIT -> {
                status.rateLimitError(failure.time());
                rateLimitedMeter.mark();
            }
            case API_ERROR -> status.apiError();
            default -> status.otherError();
        }
        log.warn("Request #{} failed with {}: {}", job.id(), failure.kind().label(), failure.message());
        if (retryPolicy.shouldRetry(job, failure)) {
            retryQueue.offer(job);
            retriedMeter.mark();
            return;
        }
        log.error("Request #{} failed after {} attempts: {}", job.id(), job.attemptsMade(), job.errorHistory());
        finishFailed(job);
    }

    private void finishFailed(Job job) {
        try {
            sink.failure(job);
        } catch (IOException e) {
            onFatal.accept(e);
            return;
        }
        status.jobFailed();
        failedMeter.mark();
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getName() : t.getClass().getSimpleName() + ": " + msg;
    }
}

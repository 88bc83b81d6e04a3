package io.parareq.runtime;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parareq.core.Failure;
import io.parareq.core.FailureKind;
import io.parareq.core.Job;
import io.parareq.core.Transport;
import io.parareq.metrics.Metrics;
import io.parareq.retry.AttemptBudgetRetryPolicy;
import io.parareq.source.RetryQueue;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class DispatcherTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final RetryQueue retryQueue = new RetryQueue();
    private final StatusTracker status = new StatusTracker();
    private final RecordingSink sink = new RecordingSink();
    private final List<Throwable> fatal = new ArrayList<>();

    private Dispatcher dispatcher(Transport transport) {
        // direct executor: outcomes are handled on the calling thread
        return new Dispatcher(transport, new ResponseClassifier("Rate limit"), new AttemptBudgetRetryPolicy(), retryQueue,
                status, sink, Clock.fixed(NOW, ZoneOffset.UTC), Runnable::run, new Metrics(new MetricRegistry()), fatal::add);
    }

    private Job admitted(int maxAttempts) {
        Job job = new Job(7, mapper.createObjectNode().put("input", "x"), null, 1, maxAttempts);
        status.jobStarted();
        job.beginAttempt();
        return job;
    }

    private JsonNode json(String s) throws IOException { return mapper.readTree(s); }

    @Test
    void success_is_written_once() throws Exception {
        JsonNode ok = json("{\"data\":[]}");
        Job job = admitted(3);
        dispatcher(p -> CompletableFuture.completedFuture(ok)).dispatch(job).get();

        assertEquals(1, sink.outcomes.size());
        assertSame(ok, sink.outcomes.get(0).response());
        assertEquals(1, status.succeeded());
        assertEquals(0, status.inProgress());
        assertTrue(retryQueue.isEmpty());
    }

    @Test
    void rate_limit_records_time_and_requeues() throws Exception {
        JsonNode limited = json("{\"error\":{\"message\":\"Rate limit reached\"}}");
        Job job = admitted(3);
        dispatcher(p -> CompletableFuture.completedFuture(limited)).dispatch(job).get();

        assertEquals(1, status.rateLimitErrors());
        assertEquals(0, status.apiErrors());
        assertEquals(NOW, status.lastRateLimitErrorTime().orElseThrow());
        assertEquals(1, retryQueue.size());
        assertEquals(1, job.errorHistory().size());
        assertTrue(sink.outcomes.isEmpty(), "retries are not logged");
        assertEquals(1, status.inProgress());
    }

    @Test
    void async_and_sync_transport_exceptions_count_as_other_errors() throws Exception {
        Job first = admitted(3);
        dispatcher(p -> CompletableFuture.failedFuture(new ConnectException("refused"))).dispatch(first).get();
        Job second = admitted(3);
        dispatcher(p -> { throw new IOException("no route"); }).dispatch(second).get();

        assertEquals(2, status.otherErrors());
        assertEquals(2, retryQueue.size());
        Failure f = first.errorHistory().get(0);
        assertEquals(FailureKind.TRANSPORT, f.kind());
        assertTrue(f.message().contains("refused"), f.message());
    }

    @Test
    void last_attempt_failure_is_terminal() throws Exception {
        JsonNode bad = json("{\"error\":{\"message\":\"invalid input\"}}");
        Job job = admitted(1);
        dispatcher(p -> CompletableFuture.completedFuture(bad)).dispatch(job).get();

        assertTrue(retryQueue.isEmpty());
        assertEquals(1, status.failed());
        assertEquals(1, status.apiErrors());
        assertEquals(0, status.inProgress());
        assertEquals(1, sink.outcomes.size());
        assertEquals(1, sink.outcomes.get(0).failures().size());
    }

    @Test
    void reject_finalizes_without_calling_out() {
        Job job = new Job(1, mapper.createObjectNode(), null, 500, 3);
        status.jobStarted();
        dispatcher(p -> { throw new AssertionError("must not be called"); })
                .reject(job, new Failure(FailureKind.UNADMISSIBLE, "too big", 0, NOW, null));

        assertEquals(1, status.failed());
        assertEquals(0, job.attemptsMade(), "no attempt counted");
        assertEquals(0, job.attemptsRemaining());
        assertEquals(FailureKind.UNADMISSIBLE, sink.outcomes.get(0).failures().get(0).kind());
    }

    @Test
    void sink_failure_is_fatal() throws Exception {
        var failing = new Dispatcher(p -> CompletableFuture.completedFuture(json("{}")), new ResponseClassifier("Rate limit"),
                new AttemptBudgetRetryPolicy(), retryQueue, status, new RecordingSink() {
                    @Override public void success(Job job, JsonNode response) throws IOException { throw new IOException("disk full"); }
                }, Clock.systemUTC(), Runnable::run, new Metrics(new MetricRegistry()), fatal::add);
        failing.dispatch(admitted(1)).get();
        assertEquals(1, fatal.size());
        assertEquals("disk full", fatal.get(0).getMessage());
        assertEquals(0, status.succeeded());
    }
}

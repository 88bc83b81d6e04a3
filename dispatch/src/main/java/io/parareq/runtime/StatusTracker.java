package io.parareq.runtime;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Progress counters for one run. A single instance is shared by the admission loop and the dispatcher
 * and is only touched from the loop thread, so plain fields suffice.
 * Holds {@code started == succeeded + failed + inProgress} between any two mutations.
 */
public class StatusTracker {
    private long started;
    private long inProgress;
    private long succeeded;
    private long failed;
    private long rateLimitErrors;
    private long apiErrors;
    private long otherErrors;
    private Instant lastRateLimitErrorTime;

    void jobStarted() {
        started++;
        inProgress++;
    }

    void jobSucceeded() {
        succeeded++;
        inProgress--;
    }

    void jobFailed() {
        failed++;
        inProgress--;
    }

    void rateLimitError(Instant at) {
        rateLimitErrors++;
        lastRateLimitErrorTime = Objects.requireNonNull(at, "at");
    }

    void apiError() { apiErrors++; }
    void otherError() { otherErrors++; }

    public long started() { return started; }
    public long inProgress() { return inProgress; }
    public long succeeded() { return succeeded; }
    public long failed() { return failed; }
    public long rateLimitErrors() { return rateLimitErrors; }
    public long apiErrors() { return apiErrors; }
    public long otherErrors() { return otherErrors; }
    public Optional<Instant> lastRateLimitErrorTime() { return Optional.ofNullable(lastRateLimitErrorTime); }

    public StatusSnapshot snapshot() {
        return new StatusSnapshot(started, inProgress, succeeded, failed, rateLimitErrors, apiErrors, otherErrors, lastRateLimitErrorTime);
    }
}

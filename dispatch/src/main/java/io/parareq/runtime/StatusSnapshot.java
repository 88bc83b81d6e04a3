package io.parareq.runtime;

import java.time.Instant;

/**
 * Point-in-time copy of the run's counters.
 *
 * @param lastRateLimitErrorTime null until the first rate-limit rejection
 */
public record StatusSnapshot(
        long started,
        long inProgress,
        long succeeded,
        long failed,
        long rateLimitErrors,
        long apiErrors,
        long otherErrors,
        Instant lastRateLimitErrorTime
) {
    public boolean hasFailures() { return failed > 0; }
}

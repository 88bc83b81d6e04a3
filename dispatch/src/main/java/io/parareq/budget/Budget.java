package io.parareq.budget;

import java.time.Instant;

/**
 * Budget governs admission of outbound calls: one request unit plus the job's cost per call.
 */
public interface Budget {
    /** Bring capacity up to date with the clock. */
    void refill(Instant now);

    /** Consume one request unit and {@code cost} resource units if both are available. Return true if consumed. */
    boolean tryAcquire(double cost);

    /** Whether a job of this cost could ever be admitted, i.e. the cost fits within the limit. */
    boolean admissible(double cost);
}

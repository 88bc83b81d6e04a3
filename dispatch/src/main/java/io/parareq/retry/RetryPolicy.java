package io.parareq.retry;

import io.parareq.core.Failure;
import io.parareq.core.Job;

public interface RetryPolicy {
    /** Decide after a failed attempt (already recorded on the job) whether it goes back to the retry queue. */
    boolean shouldRetry(Job job, Failure failure);
}

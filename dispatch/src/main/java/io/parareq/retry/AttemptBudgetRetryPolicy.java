package io.parareq.retry;

import io.parareq.core.Failure;
import io.parareq.core.FailureKind;
import io.parareq.core.Job;

/**
 * Retries every retryable failure while the job still has attempts left. There is no per-job backoff:
 * rate-limit pressure is handled by the global cooldown instead.
 */
public class AttemptBudgetRetryPolicy implements RetryPolicy {
    @Override
    public boolean shouldRetry(Job job, Failure failure) {
        if (failure.kind() == FailureKind.UNADMISSIBLE) return false;
        return job.attemptsRemaining() > 0;
    }
}

package io.parareq.budget;

import java.time.Instant;
import java.util.Objects;

/**
 * Two independent token buckets: one counting requests, one counting resource units (e.g. tokens).
 * A call is admitted only when both can pay; neither is charged otherwise.
 */
public class DualBucketBudget implements Budget {
    private final RateBucket requests;
    private final RateBucket cost;

    public DualBucketBudget(RateBucket requests, RateBucket cost) {
        this.requests = Objects.requireNonNull(requests, "requests");
        this.cost = Objects.requireNonNull(cost, "cost");
    }

    @Override
    public void refill(Instant now) {
        requests.refill(now);
        cost.refill(now);
    }

    @Override
    public boolean tryAcquire(double amount) {
        if (!requests.canConsume(1) || !cost.canConsume(amount)) return false;
        requests.consume(1);
        cost.consume(amount);
        return true;
    }

    @Override
    public boolean admissible(double amount) {
        return requests.limit() >= 1 && amount >= 0 && amount <= cost.limit();
    }

    public RateBucket requests() { return requests; }
    public RateBucket cost() { return cost; }
}

package io.parareq.budget;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Token bucket with continuous, lazy refill. Capacity is real-valued and kept within {@code [0, limit]}:
 * it only grows through {@link #refill(Instant)} and only shrinks through {@link #consume(double)}.
 * Not thread-safe; owned by the admission loop.
 */
public final class RateBucket {
    private final double limit;
    private final Duration period;
    private final double ratePerNano;
    private double capacity;
    private Instant lastRefill;

    /** A bucket that starts full at {@code now}. */
    public RateBucket(double limit, Duration period, Instant now) {
        if (!(limit > 0)) throw new IllegalArgumentException("limit must be > 0 but was " + limit);
        Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) throw new IllegalArgumentException("period must be positive but was " + period);
        this.limit = limit;
        this.period = period;
        this.ratePerNano = limit / (double) period.toNanos();
        this.capacity = limit;
        this.lastRefill = Objects.requireNonNull(now, "now");
    }

    /** Advances capacity by the time elapsed since the last refill, clamped to the limit. */
    public void refill(Instant now) {
        long elapsed = Duration.between(lastRefill, now).toNanos();
        if (elapsed <= 0) return; // clock went backwards or no time passed
        capacity = Math.min(limit, capacity + elapsed * ratePerNano);
        lastRefill = now;
    }

    public boolean canConsume(double amount) {
        return capacity >= amount;
    }

    public void consume(double amount) {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0 but was " + amount);
        if (!canConsume(amount)) {
            throw new IllegalStateException("insufficient capacity: wanted " + amount + " but have " + capacity);
        }
        capacity -= amount;
    }

    public double capacity() { return capacity; }
    public double limit() { return limit; }
    public Duration period() { return period; }
    public Instant lastRefill() { return lastRefill; }

    @Override
    public String toString() {
        return "RateBucket{" +
                "limit=" + limit +
                ", period=" + period +
                ", capacity=" + capacity +
                '}';
    }
}

package io.parareq.budget;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class DualBucketBudgetTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void charges_both_buckets_only_when_both_can_pay() {
        var requests = new RateBucket(2, Duration.ofSeconds(1), T0);
        var tokens = new RateBucket(100, Duration.ofSeconds(1), T0);
        var budget = new DualBucketBudget(requests, tokens);

        assertTrue(budget.tryAcquire(60));
        assertFalse(budget.tryAcquire(60), "token bucket cannot pay");
        assertEquals(1.0, requests.capacity(), 1e-9, "request bucket untouched by a refused admission");
        assertEquals(40.0, tokens.capacity(), 1e-9);

        assertTrue(budget.tryAcquire(40));
        assertFalse(budget.tryAcquire(0), "request bucket cannot pay");
        assertEquals(0.0, tokens.capacity(), 1e-9);
    }

    @Test
    void zero_cost_ignores_an_empty_token_bucket() {
        var budget = new DualBucketBudget(new RateBucket(10, Duration.ofSeconds(1), T0), new RateBucket(5, Duration.ofMinutes(1), T0));
        assertTrue(budget.tryAcquire(5));
        assertTrue(budget.tryAcquire(0));
        assertTrue(budget.tryAcquire(0));
    }

    @Test
    void refill_advances_both() {
        var requests = new RateBucket(10, Duration.ofSeconds(1), T0);
        var tokens = new RateBucket(1000, Duration.ofSeconds(1), T0);
        var budget = new DualBucketBudget(requests, tokens);
        requests.consume(10);
        tokens.consume(1000);
        budget.refill(T0.plusMillis(100));
        assertEquals(1.0, requests.capacity(), 1e-9);
        assertEquals(100.0, tokens.capacity(), 1e-9);
    }

    @Test
    void admissible_only_up_to_the_cost_limit() {
        var budget = new DualBucketBudget(new RateBucket(1, Duration.ofSeconds(1), T0), new RateBucket(50, Duration.ofSeconds(1), T0));
        assertTrue(budget.admissible(0));
        assertTrue(budget.admissible(50));
        assertFalse(budget.admissible(50.1));
    }

    @Test
    void nothing_is_admissible_when_the_request_bucket_never_holds_a_whole_request() {
        var budget = new DualBucketBudget(new RateBucket(0.5, Duration.ofMillis(100), T0), new RateBucket(50, Duration.ofSeconds(1), T0));
        assertFalse(budget.admissible(0));
        budget.refill(T0.plusSeconds(3));
        assertFalse(budget.tryAcquire(0));
    }
}

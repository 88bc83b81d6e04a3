package io.parareq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One unit of outbound work: the request payload plus its retry budget, cost and failure history.
 * A job is owned by exactly one place at a time (held by the loop, in flight, or in the retry queue)
 * and is mutated only on the loop thread.
 */
public final class Job {
    private final long id;
    private final ObjectNode payload;
    private final JsonNode metadata; // nullable
    private final double cost;
    private final int maxAttempts;
    private int attemptsRemaining;
    private int attemptsMade;
    private final List<Failure> errorHistory = new ArrayList<>();

    public Job(long id, ObjectNode payload, JsonNode metadata, double cost, int maxAttempts) {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0 but was " + cost);
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        this.id = id;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.metadata = metadata;
        this.cost = cost;
        this.maxAttempts = maxAttempts;
        this.attemptsRemaining = maxAttempts;
    }

    public long id() { return id; }
    public ObjectNode payload() { return payload; }
    public JsonNode metadata() { return metadata; }
    public boolean hasMetadata() { return metadata != null && !metadata.isNull(); }
    public double cost() { return cost; }
    public int attemptsRemaining() { return attemptsRemaining; }
    public int attemptsMade() { return attemptsMade; }
    public int maxAttempts() { return maxAttempts; }
    public List<Failure> errorHistory() { return Collections.unmodifiableList(errorHistory); }

    /** Counts one dispatch attempt against the budget. */
    public void beginAttempt() {
        if (attemptsRemaining <= 0) {
            throw new IllegalStateException("job " + id + " has no attempts remaining");
        }
        attemptsRemaining--;
        attemptsMade++;
    }

    public void recordFailure(Failure failure) {
        errorHistory.add(Objects.requireNonNull(failure, "failure"));
    }

    /** Drops the remaining budget so the next failure is terminal. */
    public void exhaust() { attemptsRemaining = 0; }

    @Override
    public String toString() {
        return "Job{" +
                "id=" + id +
                ", cost=" + cost +
                ", attemptsRemaining=" + attemptsRemaining +
                ", failures=" + errorHistory.size() +
                '}';
    }
}

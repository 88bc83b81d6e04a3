package io.parareq.source;

import io.parareq.core.Job;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;

/**
 * Unbounded FIFO of jobs awaiting another attempt. The admission loop always drains it before reading
 * new jobs. Confined to the loop thread.
 */
public class RetryQueue {
    private final ArrayDeque<Job> queue = new ArrayDeque<>();

    public void offer(Job job) { queue.addLast(Objects.requireNonNull(job, "job")); }

    public Optional<Job> poll() { return Optional.ofNullable(queue.pollFirst()); }

    public int size() { return queue.size(); }

    public boolean isEmpty() { return queue.isEmpty(); }
}

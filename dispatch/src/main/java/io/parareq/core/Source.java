package io.parareq.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces items in order. Finite sources signal exhaustion through {@link #isFinished()}.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next item if any. Returns empty once the source is exhausted; callers rely on
     * {@link #isFinished()} to tell exhaustion apart from a temporarily empty source.
     */
    Optional<T> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more items.
     */
    boolean isFinished();

    /** Human-readable origin used in error messages, e.g. the input path. */
    default String name() { return getClass().getSimpleName(); }

    @Override
    default void close() {}
}

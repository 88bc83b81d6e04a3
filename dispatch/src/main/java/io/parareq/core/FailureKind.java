package io.parareq.core;

/** Classification of a failed dispatch attempt. */
public enum FailureKind {
    /** The provider rejected the call because a rate limit was hit. Triggers the global cooldown. */
    RATE_LIMIT("rate_limit"),
    /** The provider returned a structured error other than a rate limit. */
    API_ERROR("api_error"),
    /** No response was obtained: the call raised, timed out, or returned something unreadable. */
    TRANSPORT("transport"),
    /** The job's cost exceeds what the cost bucket can ever hold; it is never dispatched. */
    UNADMISSIBLE("unadmissible");

    private final String label;

    FailureKind(String label) { this.label = label; }

    public String label() { return label; }
}

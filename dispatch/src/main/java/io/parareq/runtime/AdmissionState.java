package io.parareq.runtime;

/** States of the admission loop. */
public enum AdmissionState {
    FETCHING,
    CAPACITY_CHECK,
    DISPATCH,
    /** Micro-sleep between iterations so in-flight completions can run. */
    WAIT,
    /** Global pause after a rate-limit rejection. */
    COOLDOWN,
    DRAINED
}

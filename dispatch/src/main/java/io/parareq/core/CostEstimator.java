package io.parareq.core;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Estimates the resource units (e.g. tokens) a request will consume. Called once per job when it is
 * first read. Implementations throw {@link IllegalArgumentException} for payloads they cannot cost.
 */
@FunctionalInterface
public interface CostEstimator {
    /** Estimator for providers without a cost limit. */
    CostEstimator ZERO = payload -> 0;

    double estimate(ObjectNode payload);
}

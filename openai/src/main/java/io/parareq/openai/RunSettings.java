package io.parareq.openai;

import io.parareq.config.DispatchConfig;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything one CLI run is wired from.
 *
 * @param apiKey  explicit key, or null to fall back to the environment
 * @param timeout per-request HTTP timeout, or null for none
 */
public record RunSettings(
        Path requestsFile,
        Path resultsFile,
        String requestUrl,
        String apiKey,
        String tokenEncoding,
        String costEstimator,
        Duration timeout,
        DispatchConfig dispatch
) {}

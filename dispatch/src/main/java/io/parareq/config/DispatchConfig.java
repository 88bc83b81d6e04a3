package io.parareq.config;

import java.time.Duration;

/**
 * Engine parameters for one run.
 *
 * @param requestLimit       requests allowed per {@code requestPeriod}
 * @param costLimit          resource units (e.g. tokens) allowed per {@code costPeriod}
 * @param maxAttempts        dispatch attempts per job, first one included
 * @param cooldown           global pause on new admissions after a rate-limit rejection
 * @param loopSleep          pause between loop iterations; caps the loop's own admission rate
 * @param rateLimitSignature substring of a provider error message that marks a rate-limit rejection
 * @param reportInterval     how often progress is logged; zero disables reporting
 */
public record DispatchConfig(
        double requestLimit,
        Duration requestPeriod,
        double costLimit,
        Duration costPeriod,
        int maxAttempts,
        Duration cooldown,
        Duration loopSleep,
        String rateLimitSignature,
        Duration reportInterval
) {
    public static final String DEFAULT_RATE_LIMIT_SIGNATURE = "Rate limit";

    public static DispatchConfig defaults() {
        return new DispatchConfig(3_500 * 0.75, Duration.ofMinutes(1), 90_000 * 0.75, Duration.ofMinutes(1),
                5, Duration.ofSeconds(15), Duration.ofMillis(1), DEFAULT_RATE_LIMIT_SIGNATURE, Duration.ofSeconds(15));
    }

    public static DispatchConfig fromEnv() {
        DispatchConfig d = defaults();
        double requests = Double.parseDouble(setting("parareq.requests", "PARAREQ_REQUESTS", Double.toString(d.requestLimit())));
        long requestPeriod = Long.parseLong(setting("parareq.requestPeriod", "PARAREQ_REQUEST_PERIOD", Long.toString(d.requestPeriod().toSeconds())));
        double cost = Double.parseDouble(setting("parareq.cost", "PARAREQ_COST", Double.toString(d.costLimit())));
        long costPeriod = Long.parseLong(setting("parareq.costPeriod", "PARAREQ_COST_PERIOD", Long.toString(d.costPeriod().toSeconds())));
        int attempts = Integer.parseInt(setting("parareq.maxAttempts", "PARAREQ_MAX_ATTEMPTS", Integer.toString(d.maxAttempts())));
        long cooldown = Long.parseLong(setting("parareq.cooldown", "PARAREQ_COOLDOWN", Long.toString(d.cooldown().toSeconds())));
        long sleep = Long.parseLong(setting("parareq.loopSleepMillis", "PARAREQ_LOOP_SLEEP_MILLIS", Long.toString(d.loopSleep().toMillis())));
        String signature = setting("parareq.rateLimitSignature", "PARAREQ_RATE_LIMIT_SIGNATURE", d.rateLimitSignature());
        long report = Long.parseLong(setting("parareq.reportSeconds", "PARAREQ_REPORT_SECONDS", Long.toString(d.reportInterval().toSeconds())));
        return new DispatchConfig(requests, Duration.ofSeconds(requestPeriod), cost, Duration.ofSeconds(costPeriod),
                attempts, Duration.ofSeconds(cooldown), Duration.ofMillis(sleep), signature, Duration.ofSeconds(report));
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }

    /** @throws IllegalArgumentException naming the first invalid field */
    public DispatchConfig validate() {
        // every admission takes one whole request unit
        if (!(requestLimit >= 1)) throw new IllegalArgumentException("requestLimit must be >= 1 but was " + requestLimit);
        requirePositive("requestPeriod", requestPeriod);
        if (!(costLimit > 0)) throw new IllegalArgumentException("costLimit must be > 0 but was " + costLimit);
        requirePositive("costPeriod", costPeriod);
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        requireNonNegative("cooldown", cooldown);
        requireNonNegative("loopSleep", loopSleep);
        requireNonNegative("reportInterval", reportInterval);
        if (rateLimitSignature == null || rateLimitSignature.isEmpty()) {
            throw new IllegalArgumentException("rateLimitSignature must not be empty");
        }
        return this;
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive but was " + d);
    }

    private static void requireNonNegative(String name, Duration d) {
        if (d == null || d.isNegative()) throw new IllegalArgumentException(name + " must not be negative but was " + d);
    }
}

package io.parareq.openai;

import io.parareq.core.CostEstimator;

import java.util.Locale;

/** Resolves the {@code --cost-estimator} option. */
public final class CostEstimators {
    public static final String OPENAI = "openai";
    public static final String ZERO = "zero";

    private CostEstimators() {}

    /** @throws IllegalArgumentException for an unknown name, endpoint or encoding */
    public static CostEstimator select(String name, String requestUrl, String encoding) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case OPENAI:
                return new OpenAiCostEstimator(OpenAiEndpoint.fromUrl(requestUrl), BpeTokenCounter.forEncoding(encoding));
            case ZERO:
                return CostEstimator.ZERO;
            default:
                throw new IllegalArgumentException("Unknown cost estimator '" + name + "', expected " + OPENAI + " or " + ZERO);
        }
    }
}

package io.parareq.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.parareq.core.Failure;
import io.parareq.core.FailureKind;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Sorts a completed call into success or failure. A response carries an error when it has a non-null
 * {@code error} member; it is a rate-limit rejection when the error message contains the configured
 * signature.
 */
public class ResponseClassifier {
    static final String ERROR_FIELD = "error";

    private final String rateLimitSignature;

    public ResponseClassifier(String rateLimitSignature) {
        this.rateLimitSignature = Objects.requireNonNull(rateLimitSignature, "rateLimitSignature");
    }

    /** Empty for a success, otherwise the failure to record for this attempt. */
    public Optional<Failure> classify(JsonNode response, int attempt, Instant now) {
        if (response == null || !response.isObject()) {
            String type = response == null ? "no body" : response.getNodeType().toString();
            return Optional.of(new Failure(FailureKind.TRANSPORT, "unexpected response: " + type, attempt, now, null));
        }
        JsonNode error = response.get(ERROR_FIELD);
        if (error == null || error.isNull()) return Optional.empty();
        String message = messageOf(error);
        FailureKind kind = message.contains(rateLimitSignature) ? FailureKind.RATE_LIMIT : FailureKind.API_ERROR;
        return Optional.of(new Failure(kind, message, attempt, now, error));
    }

    private static String messageOf(JsonNode error) {
        if (error.isTextual()) return error.asText();
        if (error.isObject()) return error.path("message").asText("");
        return error.toString();
    }
}

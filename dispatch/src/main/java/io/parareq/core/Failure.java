package io.parareq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One failed attempt as kept in a job's error history and written to the result log.
 *
 * @param detail provider error object when the call returned one, otherwise null
 */
public record Failure(FailureKind kind, String message, int attempt, Instant time, JsonNode detail) {
    public Failure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(time, "time");
        message = message == null ? "" : message;
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("kind", kind.label());
        node.put("message", message);
        node.put("attempt", attempt);
        node.put("time", time.toString());
        if (detail != null && !detail.isNull()) node.set("detail", detail);
        return node;
    }
}

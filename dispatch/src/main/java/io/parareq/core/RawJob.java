package io.parareq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A job description as read from the input, before it is costed and given an id.
 *
 * @param line     1-based line number in the input
 * @param payload  request body with the reserved {@code metadata} member already removed
 * @param metadata the removed {@code metadata} value, or null when absent
 */
public record RawJob(long line, ObjectNode payload, JsonNode metadata) {
}

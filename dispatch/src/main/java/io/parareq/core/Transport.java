package io.parareq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletionStage;

/**
 * Issues one outbound call. The returned stage completes with the parsed response body, or
 * exceptionally when no response could be obtained. Implementations may also throw directly;
 * both are treated as transport failures.
 */
@FunctionalInterface
public interface Transport {
    CompletionStage<JsonNode> send(ObjectNode payload) throws Exception;
}

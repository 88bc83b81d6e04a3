package io.parareq.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.parareq.core.CostEstimator;

import java.util.Iterator;
import java.util.Map;

/**
 * Token usage of an OpenAI request, counted before it is sent.
 * <ul>
 *     <li>embeddings: tokens of {@code input}</li>
 *     <li>completions: tokens of {@code prompt} plus {@code n * max_tokens} per prompt</li>
 *     <li>chat completions: 4 per message, plus the tokens of every message field (one less when a
 *     {@code name} replaces the role), plus 2 for the primed reply, plus {@code n * max_tokens}</li>
 * </ul>
 */
public class OpenAiCostEstimator implements CostEstimator {
    static final int DEFAULT_MAX_TOKENS = 15;
    static final int DEFAULT_N = 1;

    private final OpenAiEndpoint endpoint;
    private final TokenCounter tokens;

    /** @throws IllegalArgumentException if requests to {@code endpoint} cannot be costed */
    public OpenAiCostEstimator(OpenAiEndpoint endpoint, TokenCounter tokens) {
        if (!endpoint.isCostable()) {
            throw new IllegalArgumentException("API endpoint \"" + endpoint + "\" has no token estimate; use the zero estimator");
        }
        this.endpoint = endpoint;
        this.tokens = tokens;
    }

    @Override
    public double estimate(ObjectNode payload) {
        if (endpoint.isEmbeddings()) return embeddingTokens(payload);
        int completion = payload.path("n").asInt(DEFAULT_N) * payload.path("max_tokens").asInt(DEFAULT_MAX_TOKENS);
        if (endpoint.isChat()) return chatTokens(payload) + completion;
        return promptTokens(payload, completion);
    }

    private int embeddingTokens(ObjectNode payload) {
        JsonNode input = payload.get("input");
        if (input != null && input.isTextual()) return tokens.count(input.asText());
        if (input != null && input.isArray()) return sumTexts(input, "input");
        throw new IllegalArgumentException("expecting a string or a list of strings for \"input\" in an embedding request");
    }

    private int promptTokens(ObjectNode payload, int completion) {
        JsonNode prompt = payload.get("prompt");
        if (prompt != null && prompt.isTextual()) return tokens.count(prompt.asText()) + completion;
        if (prompt != null && prompt.isArray()) return sumTexts(prompt, "prompt") + completion * prompt.size();
        throw new IllegalArgumentException("expecting a string or a list of strings for \"prompt\" in a completion request");
    }

    private int chatTokens(ObjectNode payload) {
        JsonNode messages = payload.get("messages");
        if (messages == null || !messages.isArray()) {
            throw new IllegalArgumentException("expecting a list for \"messages\" in a chat request");
        }
        int total = 0;
        for (JsonNode message : messages) {
            total += 4; // <im_start>{role/name}\n{content}<im_end>\n
            Iterator<Map.Entry<String, JsonNode>> fields = message.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                total += tokens.count(value.isTextual() ? value.asText() : value.toString());
                if (field.getKey().equals("name")) total -= 1;
            }
        }
        return total + 2; // <im_start>assistant
    }

    private int sumTexts(JsonNode array, String field) {
        int total = 0;
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException("expecting only strings in \"" + field + "\" but found " + item.getNodeType());
            }
            total += tokens.count(item.asText());
        }
        return total;
    }
}

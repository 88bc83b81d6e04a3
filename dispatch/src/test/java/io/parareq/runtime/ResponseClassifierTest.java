package io.parareq.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.parareq.core.Failure;
import io.parareq.core.FailureKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseClassifierTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final ResponseClassifier classifier = new ResponseClassifier("Rate limit");

    @Test
    void response_without_error_is_success() throws Exception {
        assertTrue(classifier.classify(mapper.readTree("{\"data\":[1]}"), 1, Instant.EPOCH).isEmpty());
        assertTrue(classifier.classify(mapper.readTree("{\"error\":null}"), 1, Instant.EPOCH).isEmpty());
    }

    @Test
    void rate_limit_is_matched_on_the_error_message() throws Exception {
        Failure f = classifier.classify(mapper.readTree("{\"error\":{\"message\":\"Rate limit reached for requests\"}}"), 2, Instant.EPOCH).orElseThrow();
        assertEquals(FailureKind.RATE_LIMIT, f.kind());
        assertEquals(2, f.attempt());
        assertEquals("Rate limit reached for requests", f.detail().get("message").asText());
    }

    @Test
    void other_errors_are_api_errors() throws Exception {
        Failure f = classifier.classify(mapper.readTree("{\"error\":{\"message\":\"invalid model\"}}"), 1, Instant.EPOCH).orElseThrow();
        assertEquals(FailureKind.API_ERROR, f.kind());
        Failure text = classifier.classify(mapper.readTree("{\"error\":\"boom\"}"), 1, Instant.EPOCH).orElseThrow();
        assertEquals(FailureKind.API_ERROR, text.kind());
        assertEquals("boom", text.message());
    }

    @Test
    void signature_is_configurable() throws Exception {
        var custom = new ResponseClassifier("Too Many Requests");
        var body = mapper.readTree("{\"error\":{\"message\":\"429 Too Many Requests\"}}");
        assertEquals(FailureKind.RATE_LIMIT, custom.classify(body, 1, Instant.EPOCH).orElseThrow().kind());
        assertEquals(FailureKind.API_ERROR, classifier.classify(body, 1, Instant.EPOCH).orElseThrow().kind());
    }

    @Test
    void non_object_bodies_are_transport_failures() throws Exception {
        assertEquals(FailureKind.TRANSPORT, classifier.classify(mapper.readTree("[1]"), 1, Instant.EPOCH).orElseThrow().kind());
        assertEquals(FailureKind.TRANSPORT, classifier.classify(null, 1, Instant.EPOCH).orElseThrow().kind());
    }
}

package io.parareq.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.parareq.core.Failure;
import io.parareq.core.FailureKind;
import io.parareq.core.Job;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesResultSinkTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writes_success_and_failure_lines() throws Exception {
        Path out = Files.createTempDirectory("sink-test").resolve("nested/results.jsonl");
        ObjectNode payload = mapper.createObjectNode().put("input", "hello");
        Job plain = new Job(0, payload, null, 1, 2);
        Job tagged = new Job(1, payload.deepCopy(), mapper.createObjectNode().put("row", 7), 1, 2);
        tagged.beginAttempt();
        tagged.recordFailure(new Failure(FailureKind.API_ERROR, "bad", 1, Instant.EPOCH, mapper.createObjectNode().put("message", "bad")));
        tagged.beginAttempt();
        tagged.recordFailure(new Failure(FailureKind.TRANSPORT, "IOException: reset", 2, Instant.EPOCH, null));

        try (var sink = new JsonLinesResultSink(out, mapper)) {
            sink.success(plain, mapper.createObjectNode().put("ok", true));
            sink.failure(tagged);
            assertEquals(2, sink.linesWritten());
        }

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());

        JsonNode success = mapper.readTree(lines.get(0));
        assertEquals(2, success.size(), "no metadata element when the job has none");
        assertEquals("hello", success.get(0).get("input").asText());
        assertTrue(success.get(1).get("ok").asBoolean());

        JsonNode failure = mapper.readTree(lines.get(1));
        assertEquals(3, failure.size());
        assertEquals(7, failure.get(2).get("row").asInt());
        JsonNode history = failure.get(1);
        assertEquals(2, history.size());
        assertEquals("api_error", history.get(0).get("kind").asText());
        assertEquals("bad", history.get(0).get("detail").get("message").asText());
        assertEquals("transport", history.get(1).get("kind").asText());
        assertFalse(history.get(1).has("detail"));
    }

    @Test
    void refuses_to_overwrite_existing_results() throws Exception {
        Path out = Files.createTempFile("results", ".jsonl");
        assertThrows(FileAlreadyExistsException.class, () -> new JsonLinesResultSink(out, mapper));
    }
}

package io.parareq.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.parareq.core.RawJob;
import io.parareq.error.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JsonLinesJobSourceTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void reads_lines_in_order_and_splits_metadata() {
        String input = "{\"input\":\"a\",\"metadata\":{\"row\":1}}\n{\"input\":\"b\"}\n";
        var source = new JsonLinesJobSource(new StringReader(input), "mem", mapper);

        RawJob first = source.poll().orElseThrow();
        assertEquals(1, first.line());
        assertEquals("a", first.payload().get("input").asText());
        assertFalse(first.payload().has("metadata"), "metadata is removed from the payload");
        assertEquals(1, first.metadata().get("row").asInt());

        RawJob second = source.poll().orElseThrow();
        assertEquals(2, second.line());
        assertNull(second.metadata());
        assertFalse(source.isFinished());

        assertEquals(Optional.empty(), source.poll());
        assertTrue(source.isFinished());
        assertEquals(Optional.empty(), source.poll(), "stays exhausted");
    }

    @Test
    void malformed_line_is_fatal_and_names_the_line() {
        var source = new JsonLinesJobSource(new StringReader("{\"a\":1}\n{oops\n{\"a\":3}\n"), "requests.jsonl", mapper);
        source.poll();
        MalformedInputException e = assertThrows(MalformedInputException.class, source::poll);
        assertEquals(2, e.line());
        assertEquals("requests.jsonl", e.input());
        assertTrue(e.getMessage().contains("requests.jsonl:2"));
    }

    @Test
    void rejects_non_objects_and_blank_lines() {
        var arrays = new JsonLinesJobSource(new StringReader("[1,2]\n"), "mem", mapper);
        assertThrows(MalformedInputException.class, arrays::poll);

        var blanks = new JsonLinesJobSource(new StringReader("{\"a\":1}\n\n{\"a\":2}\n"), "mem", mapper);
        blanks.poll();
        assertEquals(2, assertThrows(MalformedInputException.class, blanks::poll).line());
    }

    @Test
    void opens_files_and_reports_missing_ones() throws Exception {
        Path dir = Files.createTempDirectory("parareq-src");
        Path file = dir.resolve("requests.jsonl");
        Files.writeString(file, "{\"n\":1}\n{\"n\":2}\n");
        try (var source = new JsonLinesJobSource(file, mapper)) {
            assertEquals(file.toString(), source.name());
            assertTrue(source.poll().isPresent());
            assertTrue(source.poll().isPresent());
            assertTrue(source.poll().isEmpty());
            assertEquals(2, source.linesRead());
        }
        assertThrows(NoSuchFileException.class, () -> new JsonLinesJobSource(dir.resolve("missing.jsonl"), mapper));
    }
}

package io.parareq.openai;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class OutputPathsTest {
    @TempDir
    Path dir;

    @Test
    void derives_results_and_error_names() {
        Path requests = dir.resolve("batch.jsonl");
        assertEquals(dir.resolve("batch_results.jsonl"), OutputPaths.resultsFor(requests));
        assertEquals(dir.resolve("batch_results_with_errors.jsonl"), OutputPaths.withErrors(OutputPaths.resultsFor(requests)));
    }

    @Test
    void first_free_skips_taken_names() throws Exception {
        Path out = dir.resolve("out.jsonl");
        assertEquals(out, OutputPaths.firstFree(out));
        Files.createFile(out);
        Files.createFile(dir.resolve("out_1.jsonl"));
        assertEquals(dir.resolve("out_2.jsonl"), OutputPaths.firstFree(out));
    }
}

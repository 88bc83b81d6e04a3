package io.parareq.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.parareq.core.Failure;
import io.parareq.core.Job;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON array per terminal outcome: {@code [payload, outcome]} or
 * {@code [payload, outcome, metadata]} when the job carried metadata. The outcome is the provider
 * response for a success, or the list of failure records for a job that ran out of attempts.
 * <p>
 * The file must not exist yet; it stays open for the whole run and each line is flushed as written.
 */
public class JsonLinesResultSink implements ResultSink {
    private final Path file;
    private final ObjectMapper mapper;
    private final BufferedWriter writer;
    private long lines = 0;

    /**
     * @throws java.nio.file.FileAlreadyExistsException if {@code file} exists
     * @throws java.nio.file.AccessDeniedException if the file or its directory cannot be written
     */
    public JsonLinesResultSink(Path file, ObjectMapper mapper) throws IOException {
        this.file = file;
        this.mapper = mapper;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public void success(Job job, JsonNode response) throws IOException {
        write(job, response);
    }

    @Override
    public void failure(Job job) throws IOException {
        ArrayNode history = mapper.createArrayNode();
        for (Failure f : job.errorHistory()) history.add(f.toJson(mapper));
        write(job, history);
    }

    private void write(Job job, JsonNode outcome) throws IOException {
        ArrayNode line = mapper.createArrayNode();
        line.add(job.payload());
        line.add(outcome);
        if (job.hasMetadata()) line.add(job.metadata());
        writer.write(mapper.writeValueAsString(line));
        writer.newLine();
        writer.flush();
        lines++;
    }

    public Path file() { return file; }
    public long linesWritten() { return lines; }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}

package io.parareq.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.parareq.core.RawJob;
import io.parareq.core.Source;
import io.parareq.error.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams newline-delimited JSON objects, one job per line, in file order. Only the current line is
 * held in memory. The reserved {@code metadata} member is split off the payload.
 * Forward-only: once finished it stays finished.
 */
public class JsonLinesJobSource implements Source<RawJob> {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesJobSource.class);
    public static final String METADATA_FIELD = "metadata";

    private final BufferedReader reader;
    private final String name;
    private final ObjectMapper mapper;
    private long lineNo = 0;
    private boolean finished = false;

    public JsonLinesJobSource(Path file, ObjectMapper mapper) throws IOException {
        this(Files.newBufferedReader(file, StandardCharsets.UTF_8), file.toString(), mapper);
    }

    public JsonLinesJobSource(Reader reader, String name, ObjectMapper mapper) {
        this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        this.name = Objects.requireNonNull(name, "name");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws MalformedInputException if the next line is not a JSON object
     * @throws UncheckedIOException if the input cannot be read
     */
    @Override
    public Optional<RawJob> poll() {
        if (finished) return Optional.empty();
        String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + name, e);
        }
        if (line == null) {
            finished = true;
            closeQuietly();
            return Optional.empty();
        }
        lineNo++;
        return Optional.of(parse(line));
    }

    private RawJob parse(String line) {
        if (line.isBlank()) {
            throw new MalformedInputException(name, lineNo, "blank line", null);
        }
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException(name, lineNo, e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode payload)) {
            throw new MalformedInputException(name, lineNo, "expected a JSON object but found " + node.getNodeType(), null);
        }
        JsonNode metadata = payload.remove(METADATA_FIELD);
        return new RawJob(lineNo, payload, metadata);
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public String name() { return name; }

    public long linesRead() { return lineNo; }

    @Override
    public void close() {
        finished = true;
        closeQuietly();
    }

    private void closeQuietly() {
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("Failed closing {}", name, e);
        }
    }
}

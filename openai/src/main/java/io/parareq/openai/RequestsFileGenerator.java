package io.parareq.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes an example requests file of embedding calls, one per line. */
public class RequestsFileGenerator {
    private static final Logger log = LoggerFactory.getLogger(RequestsFileGenerator.class);

    public static final int DEFAULT_COUNT = 10_000;
    public static final String MODEL = "text-embedding-ada-002";

    private final ObjectMapper mapper;

    public RequestsFileGenerator(ObjectMapper mapper) { this.mapper = mapper; }

    public Path write(Path file, int count) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (int i = 0; i < count; i++) {
                ObjectNode req = mapper.createObjectNode();
                req.put("model", MODEL);
                req.put("input", i + "\n");
                w.write(mapper.writeValueAsString(req));
                w.newLine();
            }
        }
        log.info("Wrote {} example requests to {}", count, file);
        return file;
    }
}

package io.parareq.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.parareq.core.Transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * POSTs each payload as JSON with HttpClient.sendAsync. Any JSON body is handed back whatever the
 * status code, since providers report errors (rate limits included) inside the body. A body that is
 * not JSON fails the stage.
 */
public class HttpJsonTransport implements Transport {
    private final HttpClient client;
    private final URI uri;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public HttpJsonTransport(URI uri, Map<String, String> headers, Duration timeout, ObjectMapper mapper) {
        this(HttpClient.newBuilder().executor(Outbound.executor()).build(), uri, headers, timeout, mapper);
    }

    HttpJsonTransport(HttpClient client, URI uri, Map<String, String> headers, Duration timeout, ObjectMapper mapper) {
        this.client = client;
        this.uri = uri;
        this.headers = Map.copyOf(headers);
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public CompletionStage<JsonNode> send(ObjectNode payload) throws JsonProcessingException {
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(payload)));
        if (timeout != null) req.timeout(timeout);
        headers.forEach(req::header);
        return client.sendAsync(req.build(), HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(this::parse);
    }

    private JsonNode parse(HttpResponse<byte[]> resp) {
        try {
            return mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new CompletionException(new IOException("HTTP " + resp.statusCode() + " from " + uri + " with a body that is not JSON", e));
        }
    }

    public URI uri() { return uri; }

    // Outbound HTTP executor isolation
    static final class Outbound {
        private static final ExecutorService EXEC =
                Executors.newFixedThreadPool(Integer.getInteger("parareq.iohttp", 8), r -> {
                    Thread t = new Thread(r, "http-async"); t.setDaemon(true); return t;
                });
        static ExecutorService executor() { return EXEC; }
    }
}

package io.parareq.openai;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * API endpoint path taken from a request URL, e.g. {@code chat/completions} for
 * {@code https://api.openai.com/v1/chat/completions}.
 */
public record OpenAiEndpoint(String path) {
    private static final Pattern VERSIONED_PATH = Pattern.compile("^https://[^/]+/v\\d+/(.+)$");

    /** @throws IllegalArgumentException if the URL is not an https URL with a versioned path */
    public static OpenAiEndpoint fromUrl(String url) {
        Matcher m = VERSIONED_PATH.matcher(url);
        if (!m.matches()) {
            throw new IllegalArgumentException("URL doesn't match https://<host>/v<n>/<endpoint>: " + url);
        }
        return new OpenAiEndpoint(m.group(1));
    }

    public boolean isChat() { return path.startsWith("chat/"); }

    public boolean isCompletions() { return path.endsWith("completions"); }

    public boolean isEmbeddings() { return path.equals("embeddings"); }

    /** True for the endpoints whose token usage can be estimated. */
    public boolean isCostable() { return isCompletions() || isEmbeddings(); }

    @Override
    public String toString() { return path; }
}

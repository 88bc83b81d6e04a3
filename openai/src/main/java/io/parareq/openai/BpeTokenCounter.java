package io.parareq.openai;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;

import java.util.List;

/** Exact token counts from the named BPE encoding ({@code cl100k_base}, {@code o200k_base}, ...). */
public final class BpeTokenCounter implements TokenCounter {
    static final List<String> ENCODINGS = List.of("cl100k_base", "o200k_base", "p50k_base", "p50k_edit", "r50k_base");

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    private BpeTokenCounter(Encoding encoding) {
        this.encoding = encoding;
    }

    /** @throws IllegalArgumentException for an unknown encoding name */
    public static BpeTokenCounter forEncoding(String name) {
        Encoding encoding = REGISTRY.getEncoding(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown token encoding '" + name + "', expected one of " + ENCODINGS));
        return new BpeTokenCounter(encoding);
    }

    @Override
    public int count(String text) {
        return encoding.countTokens(text);
    }

    public String encoding() { return encoding.getName(); }
}

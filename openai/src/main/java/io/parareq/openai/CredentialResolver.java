package io.parareq.openai;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/** Finds the API key: an explicit value wins, then the {@value #ENV_VAR} environment variable. */
public final class CredentialResolver {
    public static final String ENV_VAR = "OPENAI_API_KEY";

    private final Function<String, String> env;

    public CredentialResolver() { this(System::getenv); }

    CredentialResolver(Function<String, String> env) { this.env = env; }

    public Optional<String> resolve(String explicit) {
        if (explicit != null && !explicit.isBlank()) return Optional.of(explicit);
        String fromEnv = env.apply(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) return Optional.of(fromEnv);
        return Optional.empty();
    }

    /** Request headers carrying the key, empty when no key is configured. */
    public Map<String, String> headers(String explicit) {
        return resolve(explicit).map(k -> Map.of("Authorization", "Bearer " + k)).orElse(Map.of());
    }
}

package io.parareq.openai;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CredentialResolverTest {
    @Test
    void explicit_key_wins_over_environment() {
        var resolver = new CredentialResolver(Map.of(CredentialResolver.ENV_VAR, "sk-env")::get);
        assertEquals(Optional.of("sk-cli"), resolver.resolve("sk-cli"));
        assertEquals(Optional.of("sk-env"), resolver.resolve(null));
        assertEquals(Optional.of("sk-env"), resolver.resolve(" "));
    }

    @Test
    void bearer_header_only_when_a_key_exists() {
        var none = new CredentialResolver(name -> null);
        assertTrue(none.headers(null).isEmpty());
        assertEquals(Map.of("Authorization", "Bearer k"), none.headers("k"));
    }
}

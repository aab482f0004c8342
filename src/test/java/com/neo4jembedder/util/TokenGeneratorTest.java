package com.neo4jembedder.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenGeneratorTest {

    @Test
    void generateToken_IsUrlSafe() {
        String token = TokenGenerator.generateToken();

        assertThat(token).hasSize(32);
        assertThat(token).matches("[A-Za-z0-9_-]+");
    }

    @Test
    void generateToken_DoesNotRepeat() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(TokenGenerator.generateToken());
        }

        assertThat(tokens).hasSize(1000);
    }

    @Test
    void abbreviate_KeepsOnlyPrefix() {
        assertThat(TokenGenerator.abbreviate("abcdefghijkl")).isEqualTo("abcdef...");
        assertThat(TokenGenerator.abbreviate("abc")).isEqualTo("abc");
        assertThat(TokenGenerator.abbreviate(null)).isNull();
    }
}

package com.knowledgecenter.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void usesRawUtf8BytesOfTheSecret() {
        String secret = "0123456789abcdef0123456789abcdef";

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(provider.getSecretKey().getAlgorithm()).isEqualTo("HmacSHA256");
        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void rejectsMissingSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider("  "))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.secret");
    }

    @Test
    void rejectsSecretsShorterThan32Bytes() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short-secret"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }
}

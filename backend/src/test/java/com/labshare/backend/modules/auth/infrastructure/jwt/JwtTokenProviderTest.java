package com.labshare.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void acceptsBase64Secret() {
        String secret = Base64.getEncoder().encodeToString(new byte[32]);

        assertThat(new JwtTokenProvider(secret).getSecretKey().getEncoded()).hasSize(32);
    }

    @Test
    void rejectsShortSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("256 bits");
    }

    @Test
    void rejectsBlankSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider(" "))
                .isInstanceOf(IllegalStateException.class);
    }
}

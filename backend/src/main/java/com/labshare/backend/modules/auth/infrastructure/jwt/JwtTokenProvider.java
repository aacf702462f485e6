package com.labshare.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 세션 토큰 서명용 HMAC 키 래퍼.
 * Accepts a Base64 secret or raw text; anything under 256 bits is rejected at startup.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least 256 bits");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}

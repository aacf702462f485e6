package com.labshare.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

/**
 * 로그인마다 새 기기 지문을 만든다: sha256(userAgent + ":" + random nonce), hex.
 */
@Component
public class FingerprintGenerator {

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final Supplier<String> nonceSupplier;

    public FingerprintGenerator() {
        this(() -> UUID.randomUUID().toString());
    }

    FingerprintGenerator(Supplier<String> nonceSupplier) {
        this.nonceSupplier = nonceSupplier;
    }

    public String generate(String userAgent) {
        String source = (userAgent == null ? "" : userAgent) + ":" + nonceSupplier.get();
        return HexFormat.of().formatHex(sha256(source.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM).digest(input);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}

package com.labshare.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;

import com.labshare.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.labshare.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionTokenServiceTest {

    private static final String SECRET = "labshare-session-token-test-secret-0123456789";
    private static final long SEVEN_DAYS_MILLIS = Duration.ofDays(7).toMillis();

    private MutableClock clock;
    private SessionTokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T09:00:00Z");
        tokenService = new SessionTokenService(new JwtTokenProvider(SECRET), SEVEN_DAYS_MILLIS, clock);
    }

    @Test
    void issuedTokenResolvesToSessionId() {
        UUID sessionId = UUID.randomUUID();

        String token = tokenService.issue(sessionId);

        assertThat(tokenService.resolveSessionId(token)).contains(sessionId);
    }

    @Test
    void tokenIsRejectedAfterExpiry() {
        String token = tokenService.issue(UUID.randomUUID());

        clock.advance(Duration.ofDays(7).minusMinutes(1));
        assertThat(tokenService.resolveSessionId(token)).isPresent();

        clock.advance(Duration.ofMinutes(2));
        assertThat(tokenService.resolveSessionId(token)).isEmpty();
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        SessionTokenService foreign = new SessionTokenService(
                new JwtTokenProvider("another-secret-that-is-long-enough-for-hs256!!"), SEVEN_DAYS_MILLIS, clock);

        String token = foreign.issue(UUID.randomUUID());

        assertThat(tokenService.resolveSessionId(token)).isEmpty();
    }

    @Test
    void tamperedOrMissingTokenIsRejected() {
        String token = tokenService.issue(UUID.randomUUID());
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        assertThat(tokenService.resolveSessionId(tampered)).isEmpty();
        assertThat(tokenService.resolveSessionId("not-a-jwt")).isEmpty();
        assertThat(tokenService.resolveSessionId("")).isEmpty();
        assertThat(tokenService.resolveSessionId(null)).isEmpty();
    }

    @Test
    void tokenPayloadCarriesOnlySessionReference() {
        UUID sessionId = UUID.randomUUID();
        String token = tokenService.issue(sessionId);

        String payload = new String(java.util.Base64.getUrlDecoder().decode(token.split("\\.")[1]));

        assertThat(payload).contains("\"session_id\":\"" + sessionId + "\"");
        assertThat(payload).doesNotContain("sub");
    }
}

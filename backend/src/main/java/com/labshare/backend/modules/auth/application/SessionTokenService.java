package com.labshare.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mints and checks the bearer token. The payload carries only the session id, never the student.
 * Verification is local and never touches the datastore.
 */
@Service
public class SessionTokenService {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);

    static final String SESSION_ID_CLAIM = "session_id";

    private final JwtTokenProvider tokenProvider;
    private final long tokenTtlMillis;
    private final Clock clock;

    public SessionTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:604800000}") long tokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.tokenTtlMillis = tokenTtlMillis;
        this.clock = clock;
    }

    public String issue(UUID sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        return Jwts.builder()
                .claim(SESSION_ID_CLAIM, sessionId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(tokenTtlMillis)))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    /**
     * @return the embedded session id, or empty when the signature, expiry or claim is bad
     */
    public Optional<UUID> resolveSessionId(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (claims.getExpiration() == null) {
                log.debug("Rejected session token without expiration");
                return Optional.empty();
            }
            String sessionId = claims.get(SESSION_ID_CLAIM, String.class);
            if (sessionId == null) {
                return Optional.empty();
            }
            return Optional.of(UUID.fromString(sessionId));
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected session token: {}", ex.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    public long getTokenTtlMillis() {
        return tokenTtlMillis;
    }
}

package com.labshare.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.application.GuardDecision.State;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Request-time check of the two credentials: token first (local), then the session row.
 */
@Component
public class AuthGuard {

    private static final Logger log = LoggerFactory.getLogger(AuthGuard.class);

    private final SessionTokenService sessionTokenService;
    private final SessionService sessionService;

    public AuthGuard(SessionTokenService sessionTokenService, SessionService sessionService) {
        this.sessionTokenService = sessionTokenService;
        this.sessionService = sessionService;
    }

    public GuardDecision evaluate(String token, String fingerprint) {
        if (token == null || token.isBlank()) {
            return GuardDecision.of(State.NO_TOKEN);
        }
        Optional<UUID> sessionId = sessionTokenService.resolveSessionId(token);
        if (sessionId.isEmpty()) {
            return GuardDecision.of(State.TOKEN_INVALID);
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            return GuardDecision.of(State.NO_FINGERPRINT);
        }

        AuthOutcome<UUID> outcome = sessionService.verify(sessionId.get(), fingerprint);
        if (outcome instanceof AuthOutcome.Ok<UUID> ok) {
            return GuardDecision.authenticated(ok.value(), sessionId.get());
        }
        if (outcome instanceof AuthOutcome.Invalid<UUID> invalid) {
            log.debug("Session {} rejected: {}", sessionId.get(), invalid.reason());
            return GuardDecision.of(State.SESSION_INVALID);
        }
        return GuardDecision.of(State.SESSION_UNAVAILABLE);
    }
}

package com.labshare.backend.modules.auth.application;

import java.util.UUID;

public record GuardDecision(State state, UUID studentId, UUID sessionId) {

    public enum State {
        NO_TOKEN,
        TOKEN_INVALID,
        NO_FINGERPRINT,
        SESSION_INVALID,
        SESSION_UNAVAILABLE,
        AUTHENTICATED
    }

    static GuardDecision of(State state) {
        return new GuardDecision(state, null, null);
    }

    static GuardDecision authenticated(UUID studentId, UUID sessionId) {
        return new GuardDecision(State.AUTHENTICATED, studentId, sessionId);
    }

    public boolean isAuthenticated() {
        return state == State.AUTHENTICATED;
    }

    /**
     * The credentials point at a dead session and should be dropped by the client.
     */
    public boolean shouldClearCredentials() {
        return state == State.SESSION_INVALID;
    }
}

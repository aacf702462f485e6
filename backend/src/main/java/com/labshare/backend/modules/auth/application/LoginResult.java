package com.labshare.backend.modules.auth.application;

import java.util.UUID;

/**
 * Credentials handed to the client after a successful code verification.
 */
public record LoginResult(UUID studentId, String email, String name, String token, String fingerprint) {

    @Override
    public String toString() {
        return "LoginResult[studentId=" + studentId + ", email=" + email + "]";
    }
}

package com.labshare.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.domain.SessionRevocationReason;
import com.labshare.backend.modules.auth.domain.UserSession;

public interface SessionStore {

    void insert(UserSession session);

    /**
     * Single read matching id, fingerprint and {@code revoked = false}.
     */
    Optional<UserSession> findActive(UUID sessionId, String fingerprint);

    /**
     * Revokes the session if it is live and bound to a different fingerprint.
     *
     * @return {@code true} when a live session was revoked
     */
    boolean revokeIfFingerprintDiffers(UUID sessionId, String presentedFingerprint,
                                       OffsetDateTime revokedAt, SessionRevocationReason reason);

    void touchLastSeen(UUID sessionId, OffsetDateTime lastSeenAt);

    boolean revoke(UUID sessionId, OffsetDateTime revokedAt, SessionRevocationReason reason);

    int revokeAllForStudent(UUID studentId, OffsetDateTime revokedAt, SessionRevocationReason reason);

    int deleteRevokedCreatedBefore(OffsetDateTime cutoff);

    int deleteActiveCreatedBefore(OffsetDateTime cutoff);
}

package com.labshare.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.application.SessionStore;
import com.labshare.backend.modules.auth.domain.SessionRevocationReason;
import com.labshare.backend.modules.auth.domain.UserSession;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaSessionStore implements SessionStore {

    private final UserSessionRepository userSessionRepository;

    public JpaSessionStore(UserSessionRepository userSessionRepository) {
        this.userSessionRepository = userSessionRepository;
    }

    @Override
    @Transactional
    public void insert(UserSession session) {
        userSessionRepository.saveAndFlush(session);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserSession> findActive(UUID sessionId, String fingerprint) {
        return userSessionRepository.findByIdAndFingerprintAndRevokedFalse(sessionId, fingerprint);
    }

    @Override
    @Transactional
    public boolean revokeIfFingerprintDiffers(UUID sessionId, String presentedFingerprint,
                                              OffsetDateTime revokedAt, SessionRevocationReason reason) {
        return userSessionRepository.revokeIfFingerprintDiffers(sessionId, presentedFingerprint, revokedAt, reason) > 0;
    }

    @Override
    @Transactional
    public void touchLastSeen(UUID sessionId, OffsetDateTime lastSeenAt) {
        userSessionRepository.touchLastSeen(sessionId, lastSeenAt);
    }

    @Override
    @Transactional
    public boolean revoke(UUID sessionId, OffsetDateTime revokedAt, SessionRevocationReason reason) {
        return userSessionRepository.revoke(sessionId, revokedAt, reason) > 0;
    }

    @Override
    @Transactional
    public int revokeAllForStudent(UUID studentId, OffsetDateTime revokedAt, SessionRevocationReason reason) {
        return userSessionRepository.revokeAllForStudent(studentId, revokedAt, reason);
    }

    @Override
    @Transactional
    public int deleteRevokedCreatedBefore(OffsetDateTime cutoff) {
        return userSessionRepository.deleteRevokedCreatedBefore(cutoff);
    }

    @Override
    @Transactional
    public int deleteActiveCreatedBefore(OffsetDateTime cutoff) {
        return userSessionRepository.deleteActiveCreatedBefore(cutoff);
    }
}

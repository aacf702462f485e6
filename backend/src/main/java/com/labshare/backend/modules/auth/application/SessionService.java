package com.labshare.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.audit.application.AuditLogService;
import com.labshare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.labshare.backend.modules.auth.domain.SessionRevocationReason;
import com.labshare.backend.modules.auth.domain.UserSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 기기에 묶인 세션의 생성/검증/폐기.
 *
 * <p>A live session presented with a different fingerprint is revoked on the spot. The token was
 * most likely copied to another device, so the session is burned rather than merely rejected.</p>
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    static final String AUDIT_RESOURCE_TYPE = "USER_SESSION";
    static final String AUDIT_FINGERPRINT_MISMATCH = "SESSION_FINGERPRINT_MISMATCH";
    static final String AUDIT_LOGOUT_ALL = "SESSION_LOGOUT_ALL";

    private final SessionStore sessionStore;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public SessionService(SessionStore sessionStore, AuditLogService auditLogService, Clock clock) {
        this.sessionStore = sessionStore;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * @throws SessionPersistenceException when the row could not be written; the login must fail
     */
    public UUID create(UUID studentId, String fingerprint) {
        UUID sessionId = UUID.randomUUID();
        UserSession session = new UserSession(sessionId, studentId, fingerprint, OffsetDateTime.now(clock));
        try {
            sessionStore.insert(session);
        } catch (DataAccessException ex) {
            throw new SessionPersistenceException("Failed to persist session for student " + studentId, ex);
        }
        log.info("Created session {} for student {}", sessionId, studentId);
        return sessionId;
    }

    /**
     * @return the owning student id when the session is live and bound to {@code fingerprint}
     */
    public AuthOutcome<UUID> verify(UUID sessionId, String fingerprint) {
        if (sessionId == null || fingerprint == null || fingerprint.isBlank()) {
            return AuthOutcome.invalid(InvalidReason.MALFORMED_INPUT);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<UserSession> active;
        try {
            active = sessionStore.findActive(sessionId, fingerprint);
        } catch (DataAccessException ex) {
            log.error("Session lookup failed for {}", sessionId, ex);
            return AuthOutcome.collaboratorError(ex);
        }

        if (active.isPresent()) {
            touchLastSeen(sessionId, now);
            return AuthOutcome.ok(active.get().getStudentId());
        }

        boolean revoked;
        try {
            revoked = sessionStore.revokeIfFingerprintDiffers(
                    sessionId, fingerprint, now, SessionRevocationReason.FINGERPRINT_MISMATCH);
        } catch (DataAccessException ex) {
            log.error("Fingerprint mismatch check failed for session {}", sessionId, ex);
            return AuthOutcome.collaboratorError(ex);
        }

        if (!revoked) {
            log.debug("Session {} not found or already revoked", sessionId);
            return AuthOutcome.invalid(InvalidReason.NOT_FOUND);
        }

        log.warn("SECURITY: fingerprint mismatch on session {}; session revoked", sessionId);
        auditLogService.recordQuietly(new AuditLogCommand(
                AUDIT_FINGERPRINT_MISMATCH,
                AUDIT_RESOURCE_TYPE,
                sessionId.toString(),
                null,
                Map.of("revokedAt", now.toString())
        ));
        return AuthOutcome.invalid(InvalidReason.FINGERPRINT_MISMATCH);
    }

    public boolean revoke(UUID sessionId) {
        boolean revoked = sessionStore.revoke(sessionId, OffsetDateTime.now(clock), SessionRevocationReason.LOGOUT);
        if (revoked) {
            log.info("Revoked session {}", sessionId);
        }
        return revoked;
    }

    /**
     * 로그아웃 전체: 해당 학생의 모든 살아있는 세션을 폐기한다.
     */
    public int revokeAll(UUID studentId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = sessionStore.revokeAllForStudent(studentId, now, SessionRevocationReason.LOGOUT_ALL);
        log.info("Revoked {} session(s) for student {}", revoked, studentId);
        auditLogService.recordQuietly(new AuditLogCommand(
                AUDIT_LOGOUT_ALL,
                AUDIT_RESOURCE_TYPE,
                studentId.toString(),
                studentId,
                Map.of("revokedCount", revoked)
        ));
        return revoked;
    }

    private void touchLastSeen(UUID sessionId, OffsetDateTime now) {
        try {
            sessionStore.touchLastSeen(sessionId, now);
        } catch (DataAccessException ex) {
            log.warn("Failed to update last seen for session {}", sessionId, ex);
        }
    }
}

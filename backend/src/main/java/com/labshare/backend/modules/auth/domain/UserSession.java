package com.labshare.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Device-bound login. The fingerprint is fixed at creation; revoked rows are kept until cleanup.
 */
@Entity
@Table(name = "user_session")
public class UserSession {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "fingerprint", nullable = false, updatable = false, length = 64)
    private String fingerprint;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_seen_at", nullable = false)
    private OffsetDateTime lastSeenAt;

    @Column(name = "revoked", nullable = false)
    private boolean revoked;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoked_reason", length = 32)
    private SessionRevocationReason revokedReason;

    protected UserSession() {
    }

    public UserSession(UUID id, UUID studentId, String fingerprint, OffsetDateTime createdAt) {
        this.id = id;
        this.studentId = studentId;
        this.fingerprint = fingerprint;
        this.createdAt = createdAt;
        this.lastSeenAt = createdAt;
        this.revoked = false;
    }

    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(OffsetDateTime lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public SessionRevocationReason getRevokedReason() {
        return revokedReason;
    }

    public void revoke(OffsetDateTime at, SessionRevocationReason reason) {
        this.revoked = true;
        this.revokedAt = at;
        this.revokedReason = reason;
    }
}

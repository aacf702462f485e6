package com.labshare.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 발급된 일회용 로그인 코드.
 * At most one row per student has {@code consumed = false}; issuing a new code consumes the others.
 */
@Entity
@Table(name = "auth_code")
public class AuthCode {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "code", nullable = false, updatable = false, length = 6)
    private String code;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "consumed", nullable = false)
    private boolean consumed;

    @Column(name = "consumed_at")
    private OffsetDateTime consumedAt;

    protected AuthCode() {
    }

    public AuthCode(UUID id, UUID studentId, String code, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.id = id;
        this.studentId = studentId;
        this.code = code;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.consumed = false;
    }

    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public String getCode() {
        return code;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isConsumed() {
        return consumed;
    }

    public OffsetDateTime getConsumedAt() {
        return consumedAt;
    }

    public void markConsumed(OffsetDateTime at) {
        this.consumed = true;
        this.consumedAt = at;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }
}

package com.labshare.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.domain.SessionRevocationReason;
import com.labshare.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findByIdAndFingerprintAndRevokedFalse(UUID id, String fingerprint);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revoked = true,
                   us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id = :id
               and us.revoked = false
               and us.fingerprint <> :fingerprint
            """)
    int revokeIfFingerprintDiffers(@Param("id") UUID id,
                                   @Param("fingerprint") String fingerprint,
                                   @Param("revokedAt") OffsetDateTime revokedAt,
                                   @Param("reason") SessionRevocationReason reason);

    @Modifying
    @Query("update UserSession us set us.lastSeenAt = :lastSeenAt where us.id = :id and us.revoked = false")
    int touchLastSeen(@Param("id") UUID id, @Param("lastSeenAt") OffsetDateTime lastSeenAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revoked = true,
                   us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id = :id
               and us.revoked = false
            """)
    int revoke(@Param("id") UUID id,
               @Param("revokedAt") OffsetDateTime revokedAt,
               @Param("reason") SessionRevocationReason reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revoked = true,
                   us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.studentId = :studentId
               and us.revoked = false
            """)
    int revokeAllForStudent(@Param("studentId") UUID studentId,
                            @Param("revokedAt") OffsetDateTime revokedAt,
                            @Param("reason") SessionRevocationReason reason);

    @Modifying
    @Query("delete from UserSession us where us.revoked = true and us.createdAt < :cutoff")
    int deleteRevokedCreatedBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Modifying
    @Query("delete from UserSession us where us.revoked = false and us.createdAt < :cutoff")
    int deleteActiveCreatedBefore(@Param("cutoff") OffsetDateTime cutoff);
}

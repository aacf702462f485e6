package com.labshare.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.domain.AuthCode;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuthCodeRepository extends JpaRepository<AuthCode, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AuthCode ac
               set ac.consumed = true,
                   ac.consumedAt = :consumedAt
             where ac.studentId = :studentId
               and ac.consumed = false
            """)
    int consumeActiveCodes(@Param("studentId") UUID studentId,
                           @Param("consumedAt") OffsetDateTime consumedAt);

    Optional<AuthCode> findFirstByStudentIdAndCodeAndCreatedAtAfterOrderByCreatedAtDesc(
            UUID studentId, String code, OffsetDateTime createdAfter);

    Optional<AuthCode> findFirstByStudentIdAndCodeOrderByCreatedAtDesc(UUID studentId, String code);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AuthCode ac
               set ac.consumed = true,
                   ac.consumedAt = :consumedAt
             where ac.id = :id
               and ac.consumed = false
            """)
    int consumeIfUnconsumed(@Param("id") UUID id, @Param("consumedAt") OffsetDateTime consumedAt);

    long countByStudentIdAndCreatedAtGreaterThanEqual(UUID studentId, OffsetDateTime since);

    @Query("select min(ac.createdAt) from AuthCode ac where ac.studentId = :studentId and ac.createdAt >= :since")
    OffsetDateTime findEarliestCreatedAtSince(@Param("studentId") UUID studentId,
                                              @Param("since") OffsetDateTime since);

    @Modifying
    @Query("delete from AuthCode ac where ac.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}

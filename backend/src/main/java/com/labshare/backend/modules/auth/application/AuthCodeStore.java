package com.labshare.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.modules.auth.domain.AuthCode;

/**
 * Datastore primitives needed by the OTP issuer, verifier, rate limiter and cleanup.
 * Implementations surface datastore failures as {@link org.springframework.dao.DataAccessException}.
 */
public interface AuthCodeStore {

    /**
     * Consumes every live code of the student and inserts {@code code}, as one atomic unit.
     */
    void replaceActiveCode(AuthCode code);

    /**
     * Newest code matching student and value that was issued strictly after {@code issuedAfter}.
     */
    Optional<AuthCode> findLatest(UUID studentId, String code, OffsetDateTime issuedAfter);

    /**
     * Newest code matching student and value regardless of age. Diagnostics only.
     */
    Optional<AuthCode> findLatestAnyAge(UUID studentId, String code);

    /**
     * Marks the code consumed only if it is still unconsumed.
     *
     * @return {@code true} when this call performed the transition
     */
    boolean markConsumed(UUID codeId, OffsetDateTime consumedAt);

    void delete(UUID codeId);

    long countIssuedSince(UUID studentId, OffsetDateTime since);

    Optional<OffsetDateTime> findEarliestIssuedSince(UUID studentId, OffsetDateTime since);

    /**
     * Deletes codes that expired before {@code cutoff}, consumed or not.
     */
    int deleteExpiredBefore(OffsetDateTime cutoff);
}

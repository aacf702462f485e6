package com.labshare.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import com.labshare.backend.modules.auth.domain.AuthCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 일회용 로그인 코드 발급/검증.
 *
 * <p>Issuing replaces the student's live code atomically. Verification consumes a code with a
 * conditional update, so concurrent attempts with one code succeed at most once. Code values are
 * never logged.</p>
 */
@Service
public class OtpService {

    private static final Logger log = LoggerFactory.getLogger(OtpService.class);

    private static final Pattern CODE_FORMAT = Pattern.compile("^\\d{6}$");
    private static final int CODE_FLOOR = 100_000;
    private static final int CODE_SPAN = 900_000;

    private final AuthCodeStore authCodeStore;
    private final Clock clock;
    private final Duration codeTtl;
    private final Duration lookupWindow;
    private final SecureRandom random = new SecureRandom();

    public OtpService(
            AuthCodeStore authCodeStore,
            Clock clock,
            @Value("${labshare.auth.otp.ttl:PT10M}") Duration codeTtl,
            @Value("${labshare.auth.otp.lookup-window:PT15M}") Duration lookupWindow
    ) {
        this.authCodeStore = authCodeStore;
        this.clock = clock;
        this.codeTtl = codeTtl;
        this.lookupWindow = lookupWindow;
    }

    public AuthOutcome<IssuedCode> issue(UUID studentId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String code = String.valueOf(CODE_FLOOR + random.nextInt(CODE_SPAN));
        AuthCode authCode = new AuthCode(UUID.randomUUID(), studentId, code, now, now.plus(codeTtl));
        try {
            authCodeStore.replaceActiveCode(authCode);
        } catch (DataAccessException ex) {
            log.error("Failed to store auth code for student {}", studentId, ex);
            return AuthOutcome.collaboratorError(ex);
        }
        log.info("Issued auth code {} for student {} (expiresAt={})", authCode.getId(), studentId, authCode.getExpiresAt());
        return AuthOutcome.ok(new IssuedCode(code, authCode.getExpiresAt()));
    }

    public AuthOutcome<UUID> verify(String code, UUID studentId) {
        if (!isWellFormed(code)) {
            log.info("Rejected malformed auth code for student {}", studentId);
            return AuthOutcome.invalid(InvalidReason.MALFORMED_INPUT);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            Optional<AuthCode> candidate = authCodeStore.findLatest(studentId, code, now.minus(lookupWindow));
            if (candidate.isEmpty()) {
                logMissDiagnostics(studentId, code);
                return AuthOutcome.invalid(InvalidReason.NOT_FOUND);
            }

            AuthCode authCode = candidate.get();
            if (authCode.isConsumed()) {
                log.info("Auth code {} for student {} already consumed", authCode.getId(), studentId);
                return AuthOutcome.invalid(InvalidReason.CONSUMED);
            }
            if (authCode.isExpiredAt(now)) {
                deleteExpired(authCode);
                return AuthOutcome.invalid(InvalidReason.EXPIRED);
            }
            if (!authCodeStore.markConsumed(authCode.getId(), now)) {
                log.info("Auth code {} for student {} consumed concurrently", authCode.getId(), studentId);
                return AuthOutcome.invalid(InvalidReason.CONSUMED);
            }
            return AuthOutcome.ok(studentId);
        } catch (DataAccessException ex) {
            log.error("Auth code verification failed for student {}", studentId, ex);
            return AuthOutcome.collaboratorError(ex);
        }
    }

    private void deleteExpired(AuthCode authCode) {
        log.info("Auth code {} for student {} expired at {}", authCode.getId(), authCode.getStudentId(), authCode.getExpiresAt());
        try {
            authCodeStore.delete(authCode.getId());
        } catch (DataAccessException ex) {
            log.warn("Failed to delete expired auth code {}", authCode.getId(), ex);
        }
    }

    private void logMissDiagnostics(UUID studentId, String code) {
        try {
            Optional<AuthCode> stale = authCodeStore.findLatestAnyAge(studentId, code);
            if (stale.isPresent()) {
                log.info("Auth code {} for student {} is outside the lookup window", stale.get().getId(), studentId);
            } else {
                log.info("No matching auth code for student {}", studentId);
            }
        } catch (DataAccessException ex) {
            log.debug("Auth code diagnostics unavailable for student {}", studentId, ex);
        }
    }

    public static boolean isWellFormed(String code) {
        return code != null && CODE_FORMAT.matcher(code).matches();
    }

    public Duration getCodeTtl() {
        return codeTtl;
    }

    public record IssuedCode(String code, OffsetDateTime expiresAt) {

        @Override
        public String toString() {
            return "IssuedCode[code=******, expiresAt=" + expiresAt + "]";
        }
    }
}

package com.labshare.backend.modules.auth.application;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.labshare.backend.global.error.ProblemException;
import com.labshare.backend.global.error.RetryableProblemException;
import com.labshare.backend.modules.auth.application.OtpDelivery.OtpDeliveryException;
import com.labshare.backend.modules.auth.application.OtpService.IssuedCode;
import com.labshare.backend.modules.student.domain.Student;
import com.labshare.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String EMAIL_NOT_FOUND = "EMAIL_NOT_FOUND";
    static final String INVALID_CODE = "INVALID_CODE";
    static final String OTP_RATE_LIMITED = "OTP_RATE_LIMITED";
    static final String OTP_DELIVERY_FAILED = "OTP_DELIVERY_FAILED";
    static final String AUTH_BACKEND_UNAVAILABLE = "AUTH_BACKEND_UNAVAILABLE";
    static final String SESSION_CREATION_FAILED = "SESSION_CREATION_FAILED";

    private final StudentRepository studentRepository;
    private final OtpService otpService;
    private final OtpRateLimiter otpRateLimiter;
    private final OtpDelivery otpDelivery;
    private final FingerprintGenerator fingerprintGenerator;
    private final SessionService sessionService;
    private final SessionTokenService sessionTokenService;
    private final AuthCleanupScheduler cleanupScheduler;

    public AuthService(
            StudentRepository studentRepository,
            OtpService otpService,
            OtpRateLimiter otpRateLimiter,
            OtpDelivery otpDelivery,
            FingerprintGenerator fingerprintGenerator,
            SessionService sessionService,
            SessionTokenService sessionTokenService,
            AuthCleanupScheduler cleanupScheduler
    ) {
        this.studentRepository = studentRepository;
        this.otpService = otpService;
        this.otpRateLimiter = otpRateLimiter;
        this.otpDelivery = otpDelivery;
        this.fingerprintGenerator = fingerprintGenerator;
        this.sessionService = sessionService;
        this.sessionTokenService = sessionTokenService;
        this.cleanupScheduler = cleanupScheduler;
    }

    /**
     * 로그인 코드 발급 후 메일 발송.
     *
     * @return seconds until the delivered code expires
     */
    public long requestCode(String email) {
        Student student = findStudent(email);

        OtpRateLimiter.Decision decision = otpRateLimiter.check(student.getId());
        if (!decision.allowed()) {
            throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, OTP_RATE_LIMITED,
                    "Too many code requests. Try again later.", decision.retryAfterSeconds());
        }

        AuthOutcome<IssuedCode> issued = otpService.issue(student.getId());
        if (!(issued instanceof AuthOutcome.Ok<IssuedCode> ok)) {
            throw unavailable();
        }

        try {
            otpDelivery.deliver(student.getEmail(), student.getName(), ok.value().code(), otpService.getCodeTtl());
        } catch (OtpDeliveryException ex) {
            log.error("Failed to deliver auth code to student {}", student.getId(), ex);
            throw new ProblemException(HttpStatus.BAD_GATEWAY, OTP_DELIVERY_FAILED,
                    "The login code could not be sent. Try again later.", ex);
        }
        return otpService.getCodeTtl().getSeconds();
    }

    public LoginResult verifyCode(String email, String code, String userAgent) {
        if (!OtpService.isWellFormed(code)) {
            throw invalidCode();
        }
        Student student = findStudent(email);

        AuthOutcome<UUID> verified = otpService.verify(code, student.getId());
        if (verified instanceof AuthOutcome.Invalid<UUID>) {
            throw invalidCode();
        }
        if (verified instanceof AuthOutcome.CollaboratorError<UUID>) {
            throw unavailable();
        }

        String fingerprint = fingerprintGenerator.generate(userAgent);
        UUID sessionId;
        try {
            sessionId = sessionService.create(student.getId(), fingerprint);
        } catch (SessionPersistenceException ex) {
            log.error("Session creation failed for student {}", student.getId(), ex);
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, SESSION_CREATION_FAILED,
                    "Login could not be completed.", ex);
        }
        String token = sessionTokenService.issue(sessionId);

        cleanupScheduler.triggerLazyInBackground();
        log.info("Student {} signed in with session {}", student.getId(), sessionId);
        return new LoginResult(student.getId(), student.getEmail(), student.getName(), token, fingerprint);
    }

    /**
     * Revokes the session behind {@code token}, if any. Never fails.
     */
    public void logout(String token) {
        Optional<UUID> sessionId = sessionTokenService.resolveSessionId(token);
        if (sessionId.isEmpty()) {
            return;
        }
        try {
            sessionService.revoke(sessionId.get());
        } catch (DataAccessException ex) {
            log.warn("Failed to revoke session {} on logout", sessionId.get(), ex);
        }
    }

    public int logoutEverywhere(UUID studentId) {
        try {
            return sessionService.revokeAll(studentId);
        } catch (DataAccessException ex) {
            log.error("Failed to revoke sessions for student {}", studentId, ex);
            throw unavailable();
        }
    }

    /**
     * 상태 조회는 조회 실패 시에도 오류 대신 비인증으로 응답한다.
     */
    public Optional<Student> findAuthenticatedStudent(UUID studentId) {
        try {
            return studentRepository.findById(studentId);
        } catch (DataAccessException ex) {
            log.warn("Student lookup failed for {}, reporting unauthenticated", studentId, ex);
            return Optional.empty();
        }
    }

    private Student findStudent(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        Optional<Student> student;
        try {
            student = studentRepository.findByEmailIgnoreCase(normalized);
        } catch (DataAccessException ex) {
            log.error("Student lookup by email failed", ex);
            throw unavailable();
        }
        return student.orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, EMAIL_NOT_FOUND,
                "No student is registered with this email."));
    }

    private static ProblemException invalidCode() {
        return new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CODE, "The code is invalid or has expired.");
    }

    private static ProblemException unavailable() {
        return new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, AUTH_BACKEND_UNAVAILABLE,
                "Authentication is temporarily unavailable.");
    }
}

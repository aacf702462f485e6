package com.labshare.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Rolling-window throttle on code issuance, counted from stored code rows.
 * Fails open when the datastore cannot be read.
 */
@Component
public class OtpRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(OtpRateLimiter.class);

    private final AuthCodeStore authCodeStore;
    private final Clock clock;
    private final int maxRequests;
    private final Duration window;

    public OtpRateLimiter(
            AuthCodeStore authCodeStore,
            Clock clock,
            @Value("${labshare.auth.otp.rate-limit.max-requests:3}") int maxRequests,
            @Value("${labshare.auth.otp.rate-limit.window:PT10M}") Duration window
    ) {
        this.authCodeStore = authCodeStore;
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.window = window;
    }

    public Decision check(UUID studentId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime windowStart = now.minus(window);
        try {
            long issued = authCodeStore.countIssuedSince(studentId, windowStart);
            if (issued < maxRequests) {
                return Decision.allow();
            }
            OffsetDateTime oldest = authCodeStore.findEarliestIssuedSince(studentId, windowStart).orElse(now);
            long waitMillis = Duration.between(now, oldest.plus(window)).toMillis();
            long retryAfterSeconds = Math.max(1L, (waitMillis + 999L) / 1000L);
            log.info("Auth code requests throttled for student {} (issued={}, retryAfter={}s)", studentId, issued, retryAfterSeconds);
            return new Decision(false, retryAfterSeconds);
        } catch (DataAccessException ex) {
            log.warn("Rate limit check failed for student {}; allowing request", studentId, ex);
            return Decision.allow();
        }
    }

    public record Decision(boolean allowed, long retryAfterSeconds) {

        static Decision allow() {
            return new Decision(true, 0L);
        }
    }
}

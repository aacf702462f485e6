package com.labshare.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.labshare.backend.global.config.TaskExecutionConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료 코드와 오래된 세션 정리.
 *
 * <p>The lazy path is throttled by a process-local timestamp. It is unsynchronized on purpose
 * because it only controls how often housekeeping runs; the deletes are idempotent.</p>
 */
@Component
public class AuthCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(AuthCleanupScheduler.class);

    private final SessionStore sessionStore;
    private final AuthCodeStore authCodeStore;
    private final Executor executor;
    private final Clock clock;
    private final Duration interval;
    private final Duration codeRetention;
    private final Duration revokedGrace;
    private final Duration sessionLifetime;

    private volatile Instant lastRunAt;

    public AuthCleanupScheduler(
            SessionStore sessionStore,
            AuthCodeStore authCodeStore,
            @Qualifier(TaskExecutionConfig.AUTH_CLEANUP_EXECUTOR) Executor executor,
            Clock clock,
            @Value("${labshare.auth.cleanup.interval:PT1H}") Duration interval,
            @Value("${labshare.auth.cleanup.code-retention:PT24H}") Duration codeRetention,
            @Value("${labshare.auth.cleanup.revoked-grace:P1D}") Duration revokedGrace,
            @Value("${jwt.expiration:604800000}") long sessionLifetimeMillis
    ) {
        this.sessionStore = sessionStore;
        this.authCodeStore = authCodeStore;
        this.executor = executor;
        this.clock = clock;
        this.interval = interval;
        this.codeRetention = codeRetention;
        this.revokedGrace = revokedGrace;
        this.sessionLifetime = Duration.ofMillis(sessionLifetimeMillis);
    }

    /**
     * Runs unless a run finished within the throttle interval. Never throws.
     */
    public CleanupResult runLazy(boolean force) {
        Instant now = clock.instant();
        Instant previous = lastRunAt;
        if (!force && previous != null && Duration.between(previous, now).compareTo(interval) < 0) {
            return CleanupResult.skippedRun();
        }
        try {
            CleanupResult result = purge(now);
            lastRunAt = now;
            return result;
        } catch (RuntimeException ex) {
            log.error("Auth cleanup failed", ex);
            return CleanupResult.empty();
        }
    }

    /**
     * Unconditional run for operators. Errors propagate to the caller.
     */
    public CleanupResult runForced() {
        Instant now = clock.instant();
        CleanupResult result = purge(now);
        lastRunAt = now;
        return result;
    }

    /**
     * Fire-and-forget lazy run, used right after a login succeeds.
     */
    public void triggerLazyInBackground() {
        try {
            executor.execute(() -> runLazy(false));
        } catch (RejectedExecutionException ex) {
            log.debug("Auth cleanup already queued; skipping trigger");
        }
    }

    @Scheduled(cron = "${labshare.auth.cleanup.cron:-}")
    public void scheduledCleanup() {
        try {
            runForced();
        } catch (DataAccessException ex) {
            log.error("Scheduled auth cleanup failed", ex);
        }
    }

    Instant getLastRunAt() {
        return lastRunAt;
    }

    private CleanupResult purge(Instant now) {
        OffsetDateTime at = OffsetDateTime.ofInstant(now, clock.getZone());
        int codes = authCodeStore.deleteExpiredBefore(at.minus(codeRetention));
        int revoked = sessionStore.deleteRevokedCreatedBefore(at.minus(revokedGrace));
        int stale = sessionStore.deleteActiveCreatedBefore(at.minus(sessionLifetime));
        int sessions = revoked + stale;
        if (sessions > 0 || codes > 0) {
            log.info("Auth cleanup removed {} session(s) and {} auth code(s)", sessions, codes);
        } else {
            log.debug("Auth cleanup found nothing to remove");
        }
        return new CleanupResult(sessions, codes, false);
    }
}

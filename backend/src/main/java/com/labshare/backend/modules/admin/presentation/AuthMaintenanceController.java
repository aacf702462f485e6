package com.labshare.backend.modules.admin.presentation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.OffsetDateTime;

import com.labshare.backend.global.error.ProblemException;
import com.labshare.backend.modules.auth.application.AuthCleanupScheduler;
import com.labshare.backend.modules.auth.application.CleanupResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 외부 cron 용 정리 트리거.
 */
@RestController
@RequestMapping("/admin/auth")
public class AuthMaintenanceController {

    private static final Logger log = LoggerFactory.getLogger(AuthMaintenanceController.class);

    static final String CLEANUP_KEY_HEADER = "X-Cleanup-Key";

    private final AuthCleanupScheduler cleanupScheduler;
    private final Clock clock;
    private final byte[] apiKey;

    public AuthMaintenanceController(
            AuthCleanupScheduler cleanupScheduler,
            Clock clock,
            @Value("${labshare.auth.cleanup.api-key:}") String apiKey
    ) {
        this.cleanupScheduler = cleanupScheduler;
        this.clock = clock;
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Operation(summary = "인증 데이터 정리", description = "만료된 로그인 코드와 오래된 세션을 즉시 삭제한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "정리 완료"),
            @ApiResponse(responseCode = "401", description = "잘못된 정리 키"),
            @ApiResponse(responseCode = "403", description = "정리 키 미설정")
    })
    @PostMapping("/cleanup")
    public ResponseEntity<CleanupResponse> cleanup(
            @RequestHeader(value = CLEANUP_KEY_HEADER, required = false) String presentedKey
    ) {
        if (apiKey == null) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "CLEANUP_DISABLED", "Cleanup endpoint is not configured.");
        }
        if (presentedKey == null
                || !MessageDigest.isEqual(apiKey, presentedKey.getBytes(StandardCharsets.UTF_8))) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CLEANUP_KEY", "Invalid cleanup key.");
        }

        CleanupResult result;
        try {
            result = cleanupScheduler.runForced();
        } catch (DataAccessException ex) {
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "CLEANUP_FAILED", "Cleanup failed.", ex);
        }
        log.info("Manual auth cleanup removed {} session(s) and {} auth code(s)",
                result.sessionsDeleted(), result.authCodesDeleted());
        return ResponseEntity.ok(new CleanupResponse(
                true,
                result.sessionsDeleted(),
                result.authCodesDeleted(),
                "Deleted " + result.sessionsDeleted() + " sessions and " + result.authCodesDeleted() + " auth codes",
                OffsetDateTime.now(clock)
        ));
    }

    public record CleanupResponse(
            boolean success,
            int sessionsDeleted,
            int authCodesDeleted,
            String message,
            OffsetDateTime executedAt
    ) {
    }
}

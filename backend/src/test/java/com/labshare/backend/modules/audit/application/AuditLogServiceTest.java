package com.labshare.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import com.labshare.backend.global.web.RequestIdFilter;
import com.labshare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.labshare.backend.modules.audit.domain.AuditLog;
import com.labshare.backend.modules.audit.infrastructure.AuditLogRepository;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceTest {

    private static final UUID STUDENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000bb");

    @Mock
    private AuditLogRepository auditLogRepository;

    private AuditLogService auditLogService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);
        auditLogService = new AuditLogService(auditLogRepository, clock);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void recordStoresCommandWithRequestId() {
        MDC.put(RequestIdFilter.REQUEST_ID_MDC_KEY, "req-42");

        auditLogService.record(command());

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog saved = captor.getValue();
        assertThat(saved.getActionType()).isEqualTo("SESSION_REVOKED");
        assertThat(saved.getActorStudentId()).isEqualTo(STUDENT_ID);
        assertThat(saved.getRequestId()).isEqualTo("req-42");
        assertThat(saved.getDetail()).containsEntry("reason", "FINGERPRINT_MISMATCH");
    }

    @Test
    void recordQuietlySurvivesRepositoryFailure() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> auditLogService.recordQuietly(command())).doesNotThrowAnyException();
        verify(auditLogRepository).save(any(AuditLog.class));
    }

    private AuditLogCommand command() {
        return new AuditLogCommand("SESSION_REVOKED", "USER_SESSION", UUID.randomUUID().toString(),
                STUDENT_ID, Map.of("reason", "FINGERPRINT_MISMATCH"));
    }
}

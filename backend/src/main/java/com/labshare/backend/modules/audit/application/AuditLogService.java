package com.labshare.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.labshare.backend.global.web.RequestIdFilter;
import com.labshare.backend.modules.audit.domain.AuditLog;
import com.labshare.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    /**
     * 호출자 트랜잭션이 있으면 합류하고, 없으면 repository 저장이 자체 트랜잭션으로 커밋된다.
     */
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog(
                command.actionType(),
                command.resourceType(),
                command.resourceKey(),
                OffsetDateTime.now(clock)
        );
        auditLog.setActorStudentId(command.actorStudentId());
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    /**
     * 감사 기록 실패가 본 요청 결과를 바꾸지 않도록 로그만 남긴다.
     */
    public void recordQuietly(AuditLogCommand command) {
        try {
            record(command);
        } catch (RuntimeException ex) {
            log.warn("Failed to write audit entry {} for {}:{}",
                    command.actionType(), command.resourceType(), command.resourceKey(), ex);
        }
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorStudentId,
            Map<String, Object> detail
    ) {
    }
}

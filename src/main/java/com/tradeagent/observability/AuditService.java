package com.tradeagent.observability;

import com.tradeagent.entity.AuditLogEntity;
import com.tradeagent.mapper.JsonHelper;
import com.tradeagent.repository.jpa.AuditLogJpaRepository;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Append-only audit trail for state changes: intent proposed, approved, executed, status
 * moved, runner failures.
 *
 * <p>An audit write failure is logged and does not fail the operation being audited; the
 * trading records themselves are written by the store in their own transactions.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogJpaRepository auditLogJpaRepository;
    private final Clock clock;

    public AuditService(AuditLogJpaRepository auditLogJpaRepository, Clock clock) {
        this.auditLogJpaRepository = auditLogJpaRepository;
        this.clock = clock;
    }

    public void log(String eventType, String entityType, String entityId, Map<String, Object> payload) {
        AuditLogEntity entity = AuditLogEntity.builder()
                .eventType(eventType)
                .entityType(entityType)
                .entityId(entityId)
                .payloadJson(payload == null || payload.isEmpty() ? null : JsonHelper.toJson(payload))
                .timestamp(clock.instant())
                .build();
        try {
            auditLogJpaRepository.save(entity);
        } catch (DataAccessException e) {
            log.warn("Failed to write audit entry {} for {} {}: {}", eventType, entityType, entityId, e.getMessage());
        }
    }
}

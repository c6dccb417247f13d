package com.valuerank.orchestration.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuerank.orchestration.domain.AuditLogEntity;
import com.valuerank.orchestration.repository.AuditLogRepository;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class DatabaseAuditSink implements AuditSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseAuditSink.class);

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public DatabaseAuditSink(
        AuditLogRepository auditLogRepository,
        ObjectMapper objectMapper,
        PlatformTransactionManager transactionManager
    ) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void record(String action, String actorId, String entityId, String entityType, Map<String, Object> metadata) {
        try {
            transactionTemplate.executeWithoutResult(status -> auditLogRepository.save(AuditLogEntity.of(
                action, actorId, entityId, entityType, objectMapper.valueToTree(metadata))));
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to write audit record {} for {} {}", action, entityType, entityId, ex);
        }
    }
}

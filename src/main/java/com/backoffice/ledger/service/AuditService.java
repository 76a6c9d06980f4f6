package com.backoffice.ledger.service;

import com.backoffice.ledger.config.LedgerProperties;
import com.backoffice.ledger.model.AuditLog;
import com.backoffice.ledger.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;

/**
 * Writes the audit trail. Runs after the business transaction has committed,
 * so a failure here is logged and never reaches the caller.
 */
@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate txTemplate;
    private final RetryTemplate retryTemplate;

    public AuditService(AuditLogRepository auditLogRepository, ObjectMapper objectMapper,
            PlatformTransactionManager txManager, LedgerProperties properties) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.txTemplate = new TransactionTemplate(txManager);
        this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(properties.getAudit().getMaxAttempts())
                .fixedBackoff(properties.getAudit().getBackoffMs())
                .retryOn(TransientDataAccessException.class)
                .traversingCauses()
                .build();
    }

    public void record(LedgerAuditEvent event) {
        try {
            String before = toJson(event.getBefore());
            String after = toJson(event.getAfter());

            // Fresh entity per attempt; a rolled-back persist may have left an id on the last one
            retryTemplate.execute(context -> txTemplate.execute(status -> {
                AuditLog log = new AuditLog();
                log.setActorId(event.getActorId() != null ? event.getActorId() : "SYSTEM");
                log.setAction(event.getAction());
                log.setEntityType(event.getEntityType());
                log.setEntityId(event.getEntityId());
                log.setBeforeSnapshot(before);
                log.setAfterSnapshot(after);
                return auditLogRepository.save(log);
            }));
            logger.debug("Audit {} recorded for {} {}", event.getAction(), event.getEntityType(), event.getEntityId());
        } catch (Exception e) {
            logger.error("Failed to write audit log for {} {} {}: {}", event.getAction(), event.getEntityType(),
                    event.getEntityId(), e.getMessage(), e);
        }
    }

    private String toJson(Map<String, Object> snapshot) throws JsonProcessingException {
        return snapshot != null ? objectMapper.writeValueAsString(snapshot) : null;
    }
}

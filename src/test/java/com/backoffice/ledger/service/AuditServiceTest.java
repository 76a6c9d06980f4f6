package com.backoffice.ledger.service;

import com.backoffice.ledger.config.LedgerProperties;
import com.backoffice.ledger.model.AuditLog;
import com.backoffice.ledger.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;
    @Mock
    private PlatformTransactionManager txManager;

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        properties.getAudit().setMaxAttempts(2);
        properties.getAudit().setBackoffMs(1);
        when(txManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        auditService = new AuditService(auditLogRepository, new ObjectMapper().findAndRegisterModules(), txManager,
                properties);
    }

    private LedgerAuditEvent paymentEvent(String actor) {
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("amount", new BigDecimal("1000.00"));
        after.put("creditId", 7L);
        return new LedgerAuditEvent(actor, LedgerAuditEvent.RECORD_PAYMENT, "CUSTOMER_PAYMENT", "42", null, after);
    }

    @Test
    void record_ShouldStoreSnapshotsAsJson() {
        auditService.record(paymentEvent("clerk"));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog log = captor.getValue();
        assertEquals("clerk", log.getActorId());
        assertEquals("RECORD_PAYMENT", log.getAction());
        assertEquals("CUSTOMER_PAYMENT", log.getEntityType());
        assertEquals("42", log.getEntityId());
        assertNull(log.getBeforeSnapshot());
        assertEquals("{\"amount\":1000.00,\"creditId\":7}", log.getAfterSnapshot());
    }

    @Test
    void record_ShouldAttributeAnonymousEventsToSystem() {
        auditService.record(paymentEvent(null));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertEquals("SYSTEM", captor.getValue().getActorId());
    }

    @Test
    void record_ShouldRetryTransientFailureAndThenSwallowIt() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new TransientDataAccessResourceException("database down"));

        assertDoesNotThrow(() -> auditService.record(paymentEvent("clerk")));

        verify(auditLogRepository, times(2)).save(any(AuditLog.class));
    }

    @Test
    void record_ShouldNotRetryPermanentFailure() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new DataIntegrityViolationException("value too long"));

        assertDoesNotThrow(() -> auditService.record(paymentEvent("clerk")));

        verify(auditLogRepository, times(1)).save(any(AuditLog.class));
    }
}

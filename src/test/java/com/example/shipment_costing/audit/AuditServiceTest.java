package com.example.shipment_costing.audit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.example.shipment_costing.entity.AuditLog;
import com.example.shipment_costing.repo.AuditLogRepository;

class AuditServiceTest {

    private AuditLogRepository repo;
    private AuditService audit;

    @BeforeEach
    void setUp() {
        repo = mock(AuditLogRepository.class);
        PlatformTransactionManager txManager = mock(PlatformTransactionManager.class);
        when(txManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        audit = new AuditService(repo, txManager);
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void writesImmediatelyOutsideTransaction() {
        audit.record(AuditEvent.of("admin", "SHIPMENT", 7L, AuditAction.CREATE, Map.of("shipmentCode", "SH-7")));

        ArgumentCaptor<AuditLog> row = ArgumentCaptor.forClass(AuditLog.class);
        verify(repo).save(row.capture());
        assertEquals("admin", row.getValue().getUserId());
        assertEquals("7", row.getValue().getEntityId());
        assertEquals(AuditAction.CREATE, row.getValue().getActionType());
        assertEquals("SH-7", row.getValue().getDetails().get("shipmentCode"));
        assertEquals(32, row.getValue().getCorrelationId().length());
    }

    @Test
    void blankUserIsRecordedAsSystem() {
        audit.record(AuditEvent.of(" ", "EXCHANGE_RATE", 1L, AuditAction.CREATE, null));

        ArgumentCaptor<AuditLog> row = ArgumentCaptor.forClass(AuditLog.class);
        verify(repo).save(row.capture());
        assertEquals("SYSTEM", row.getValue().getUserId());
    }

    @Test
    void writeFailureIsSwallowed() {
        when(repo.save(any(AuditLog.class))).thenThrow(new IllegalStateException("audit table missing"));

        assertDoesNotThrow(() -> audit.record(AuditEvent.of("admin", "PAYMENT", 3L, AuditAction.CREATE, null)));
    }

    @Test
    void insideTransactionWaitsForCommit() {
        TransactionSynchronizationManager.initSynchronization();

        audit.record(AuditEvent.of("admin", "PAYMENT", 3L, AuditAction.CREATE, null));
        verify(repo, never()).save(any(AuditLog.class));

        for (TransactionSynchronization sync : TransactionSynchronizationManager.getSynchronizations()) {
            sync.afterCommit();
        }
        verify(repo).save(any(AuditLog.class));
    }

    @Test
    void rolledBackTransactionLeavesNoTrail() {
        TransactionSynchronizationManager.initSynchronization();

        audit.record(AuditEvent.of("admin", "PAYMENT", 3L, AuditAction.CREATE, null));
        for (TransactionSynchronization sync : TransactionSynchronizationManager.getSynchronizations()) {
            sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }

        verify(repo, never()).save(any(AuditLog.class));
    }
}

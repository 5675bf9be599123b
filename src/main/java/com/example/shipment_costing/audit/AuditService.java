package com.example.shipment_costing.audit;

import java.util.HashMap;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.shipment_costing.entity.AuditLog;
import com.example.shipment_costing.repo.AuditLogRepository;

@Service
public class AuditService implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository repo;
    private final TransactionTemplate requiresNew;

    public AuditService(AuditLogRepository repo, PlatformTransactionManager txManager) {
        this.repo = repo;
        this.requiresNew = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Inside a transaction the row is written after commit, so a rolled-back
     * operation leaves no audit trail and an audit failure cannot roll it back.
     */
    @Override
    public void record(AuditEvent event) {
        if (event == null) {
            return;
        }
        String correlationId = cid();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            try {
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCommit() {
                        write(event, correlationId);
                    }
                });
            } catch (RuntimeException e) {
                log.error("Audit registration failed entity={} id={} cid={}",
                        event.entityType(), event.entityId(), correlationId, e);
            }
            return;
        }
        write(event, correlationId);
    }

    private void write(AuditEvent event, String correlationId) {
        try {
            requiresNew.executeWithoutResult(status -> repo.save(toLog(event, correlationId)));
            log.debug("Audit {} {}#{} by {}", event.actionType(), event.entityType(), event.entityId(),
                    event.userId());
        } catch (RuntimeException e) {
            log.error("Audit write failed entity={} id={} action={} cid={}",
                    event.entityType(), event.entityId(), event.actionType(), correlationId, e);
        }
    }

    private static AuditLog toLog(AuditEvent event, String correlationId) {
        AuditLog row = new AuditLog();
        row.setUserId(event.userId() == null || event.userId().isBlank() ? "SYSTEM" : event.userId());
        row.setEntityType(event.entityType());
        row.setEntityId(event.entityId());
        row.setActionType(event.actionType());
        row.setDetails(event.details() == null ? new HashMap<>() : new HashMap<>(event.details()));
        row.setCorrelationId(correlationId);
        return row;
    }

    private static String cid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}

package com.example.shipment_costing.audit;

/**
 * Fire-and-forget audit trail. Implementations never throw: a failed write
 * must not change the outcome of the operation being audited.
 */
public interface AuditSink {

    void record(AuditEvent event);
}

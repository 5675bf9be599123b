package com.example.shipment_costing.audit;

import java.util.Map;

public record AuditEvent(
        String userId,
        String entityType,
        String entityId,
        AuditAction actionType,
        Map<String, Object> details) {

    public static AuditEvent of(String userId, String entityType, Object entityId, AuditAction action,
            Map<String, Object> details) {
        return new AuditEvent(userId, entityType, String.valueOf(entityId), action,
                details == null ? Map.of() : details);
    }
}

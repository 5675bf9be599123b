package com.example.shipment_costing.exception;

public class NotFoundException extends RuntimeException {

    private final String entityType;
    private final Object entityId;

    public NotFoundException(String entityType, Object entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public Object getEntityId() {
        return entityId;
    }
}

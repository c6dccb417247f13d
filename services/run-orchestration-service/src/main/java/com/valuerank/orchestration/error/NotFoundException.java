package com.valuerank.orchestration.error;

public class NotFoundException extends OrchestrationException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, Object entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = String.valueOf(entityId);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}

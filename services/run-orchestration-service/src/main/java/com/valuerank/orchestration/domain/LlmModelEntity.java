package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "llm_models")
public class LlmModelEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "model_id", nullable = false, unique = true)
    private String modelId;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ModelStatus status;

    @Column(name = "is_default", nullable = false)
    private boolean isDefault;

    public static LlmModelEntity of(String providerId, String modelId, ModelStatus status, boolean isDefault) {
        LlmModelEntity entity = new LlmModelEntity();
        entity.id = UUID.randomUUID().toString();
        entity.providerId = providerId;
        entity.modelId = modelId;
        entity.status = status;
        entity.isDefault = isDefault;
        return entity;
    }

    public String getId() {
        return id;
    }

    public String getModelId() {
        return modelId;
    }

    public String getProviderId() {
        return providerId;
    }

    public ModelStatus getStatus() {
        return status;
    }

    public boolean isDefault() {
        return isDefault;
    }
}

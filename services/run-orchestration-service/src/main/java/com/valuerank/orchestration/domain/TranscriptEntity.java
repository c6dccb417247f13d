package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transcripts")
public class TranscriptEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "run_id", nullable = false)
    private String runId;

    @Column(name = "scenario_id")
    private String scenarioId;

    @Column(name = "model_id", nullable = false)
    private String modelId;

    @Column(name = "decision_code")
    private String decisionCode;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static TranscriptEntity of(String runId, String scenarioId, String modelId, String decisionCode) {
        TranscriptEntity entity = new TranscriptEntity();
        entity.id = UUID.randomUUID().toString();
        entity.runId = runId;
        entity.scenarioId = scenarioId;
        entity.modelId = modelId;
        entity.decisionCode = decisionCode;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getRunId() {
        return runId;
    }

    public String getScenarioId() {
        return scenarioId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getDecisionCode() {
        return decisionCode;
    }
}

package com.valuerank.orchestration.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "probe_jobs")
public class ProbeJobEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "queue_name", nullable = false, updatable = false)
    private String queueName;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Column(name = "scenario_id", nullable = false, updatable = false)
    private String scenarioId;

    @Column(name = "model_id", nullable = false, updatable = false)
    private String modelId;

    @Column(name = "priority", nullable = false, updatable = false)
    private int priority;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "payload", columnDefinition = "text", nullable = false, updatable = false)
    private JsonNode payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private JobStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "error_message", length = 400)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ProbeJobEntity queued(
        String queueName,
        String runId,
        String scenarioId,
        String modelId,
        int priority,
        JsonNode payload
    ) {
        ProbeJobEntity job = new ProbeJobEntity();
        job.id = UUID.randomUUID().toString();
        job.queueName = queueName;
        job.runId = runId;
        job.scenarioId = scenarioId;
        job.modelId = modelId;
        job.priority = priority;
        job.payload = payload;
        job.status = JobStatus.QUEUED;
        return job;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public void succeed() {
        this.status = JobStatus.SUCCESS;
        this.errorCode = null;
        this.errorMessage = null;
    }

    public void requeue(String errorMessage) {
        this.attempts++;
        this.status = JobStatus.QUEUED;
        this.errorMessage = errorMessage;
    }

    public void fail(String errorCode, String errorMessage) {
        this.attempts++;
        this.status = JobStatus.FAILED;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public boolean hasOutcome() {
        return status != JobStatus.QUEUED;
    }

    public String getId() {
        return id;
    }

    public String getQueueName() {
        return queueName;
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

    public int getPriority() {
        return priority;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}

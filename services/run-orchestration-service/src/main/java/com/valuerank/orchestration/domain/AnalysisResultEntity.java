package com.valuerank.orchestration.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "analysis_results")
public class AnalysisResultEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_type", nullable = false, updatable = false)
    private AnalysisType analysisType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private AnalysisStatus status;

    @Column(name = "code_version", nullable = false)
    private String codeVersion;

    @Column(name = "input_hash", nullable = false)
    private String inputHash;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "output", columnDefinition = "text", nullable = false)
    private JsonNode output;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static AnalysisResultEntity current(
        String runId,
        AnalysisType analysisType,
        String codeVersion,
        String inputHash,
        JsonNode output
    ) {
        AnalysisResultEntity entity = new AnalysisResultEntity();
        entity.id = UUID.randomUUID().toString();
        entity.runId = runId;
        entity.analysisType = analysisType;
        entity.status = AnalysisStatus.CURRENT;
        entity.codeVersion = codeVersion;
        entity.inputHash = inputHash;
        entity.output = output;
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

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public AnalysisStatus getStatus() {
        return status;
    }

    public String getCodeVersion() {
        return codeVersion;
    }

    public String getInputHash() {
        return inputHash;
    }

    public JsonNode getOutput() {
        return output;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}

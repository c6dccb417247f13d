package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
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
@Table(name = "runs")
public class RunEntity {

    public static final String AGGREGATE_TAG = "Aggregate";

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "name")
    private String name;

    @Column(name = "definition_id", nullable = false, updatable = false)
    private String definitionId;

    @Column(name = "experiment_id")
    private String experimentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunStatus status;

    @Convert(converter = RunConfigConverter.class)
    @Column(name = "config", columnDefinition = "text", nullable = false)
    private RunConfig config;

    @Embedded
    private RunProgress progress;

    @Column(name = "is_aggregate", nullable = false)
    private boolean aggregate;

    @Column(name = "created_by_user_id")
    private String createdByUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static RunEntity launch(
        String name,
        String definitionId,
        String experimentId,
        RunConfig config,
        int totalJobs,
        String createdByUserId
    ) {
        RunEntity run = new RunEntity();
        run.id = UUID.randomUUID().toString();
        run.name = name;
        run.definitionId = definitionId;
        run.experimentId = experimentId;
        run.status = RunStatus.PENDING;
        run.config = config;
        run.progress = RunProgress.initial(totalJobs);
        run.createdByUserId = createdByUserId;
        return run;
    }

    public static RunEntity aggregateOf(String definitionId, RunConfig config, String createdByUserId) {
        RunEntity run = new RunEntity();
        run.id = UUID.randomUUID().toString();
        run.name = AGGREGATE_TAG;
        run.definitionId = definitionId;
        run.status = RunStatus.COMPLETED;
        run.config = config;
        run.progress = RunProgress.initial(0);
        run.aggregate = true;
        run.createdByUserId = createdByUserId;
        run.completedAt = Instant.now();
        return run;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public void refreshAggregate(RunConfig config) {
        this.config = config;
        this.status = RunStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void transitionTo(RunStatus next, Instant at) {
        if (next == RunStatus.RUNNING && this.status == RunStatus.PENDING) {
            this.startedAt = at;
        }
        if (next.isTerminal()) {
            this.completedAt = at;
        }
        this.status = next;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public String getExperimentId() {
        return experimentId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public RunConfig getConfig() {
        return config;
    }

    public RunProgress getProgress() {
        return progress;
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public String getCreatedByUserId() {
        return createdByUserId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public void markDeleted() {
        this.deletedAt = Instant.now();
    }
}

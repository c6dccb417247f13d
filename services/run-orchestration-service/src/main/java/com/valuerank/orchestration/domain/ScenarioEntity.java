package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "scenarios")
public class ScenarioEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "definition_id", nullable = false)
    private String definitionId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static ScenarioEntity of(String definitionId, String name) {
        ScenarioEntity entity = new ScenarioEntity();
        entity.id = UUID.randomUUID().toString();
        entity.definitionId = definitionId;
        entity.name = name;
        return entity;
    }

    public String getId() {
        return id;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public String getName() {
        return name;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}

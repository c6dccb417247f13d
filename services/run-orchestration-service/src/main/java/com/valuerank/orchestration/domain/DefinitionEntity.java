package com.valuerank.orchestration.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "definitions")
public class DefinitionEntity implements DefinitionNode {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "parent_id")
    private String parentId;

    @Column(name = "domain_id")
    private String domainId;

    @Column(name = "version", nullable = false)
    private int version;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "content", columnDefinition = "text")
    private JsonNode content;

    @Column(name = "preamble_version_id")
    private String preambleVersionId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static DefinitionEntity create(String name, String parentId, String domainId, int version, JsonNode content) {
        DefinitionEntity entity = new DefinitionEntity();
        entity.id = UUID.randomUUID().toString();
        entity.name = name;
        entity.parentId = parentId;
        entity.domainId = domainId;
        entity.version = version;
        entity.content = content;
        return entity;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        if (this.updatedAt == null) {
            this.updatedAt = now;
        }
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void markDeleted() {
        this.deletedAt = Instant.now();
    }

    @Override
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getParentId() {
        return parentId;
    }

    public String getDomainId() {
        return domainId;
    }

    @Override
    public int getVersion() {
        return version;
    }

    public JsonNode getContent() {
        return content;
    }

    public String getPreambleVersionId() {
        return preambleVersionId;
    }

    public void setPreambleVersionId(String preambleVersionId) {
        this.preambleVersionId = preambleVersionId;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}

package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "llm_providers")
public class LlmProviderEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "max_parallel_requests", nullable = false)
    private int maxParallelRequests;

    @Column(name = "requests_per_minute", nullable = false)
    private int requestsPerMinute;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    public static LlmProviderEntity of(String name, int maxParallelRequests, int requestsPerMinute, boolean enabled) {
        LlmProviderEntity entity = new LlmProviderEntity();
        entity.id = UUID.randomUUID().toString();
        entity.name = name;
        entity.maxParallelRequests = maxParallelRequests;
        entity.requestsPerMinute = requestsPerMinute;
        entity.enabled = enabled;
        return entity;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getMaxParallelRequests() {
        return maxParallelRequests;
    }

    public void setMaxParallelRequests(int maxParallelRequests) {
        this.maxParallelRequests = maxParallelRequests;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public boolean isEnabled() {
        return enabled;
    }
}

package com.valuerank.orchestration.service.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.valuerank.orchestration.domain.ProbeJobEntity;
import com.valuerank.orchestration.repository.ProbeJobRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
public class DatabaseJobQueue implements JobQueue {

    private final ProbeJobRepository probeJobRepository;

    public DatabaseJobQueue(ProbeJobRepository probeJobRepository) {
        this.probeJobRepository = probeJobRepository;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public String enqueue(String queueName, JsonNode payload, int priority) {
        ProbeJobEntity job = ProbeJobEntity.queued(
            queueName,
            payload.path("runId").asText(),
            payload.path("scenarioId").asText(),
            payload.path("modelId").asText(),
            priority,
            payload);
        return probeJobRepository.save(job).getId();
    }
}

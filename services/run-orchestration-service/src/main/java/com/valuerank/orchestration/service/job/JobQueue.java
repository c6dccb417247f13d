package com.valuerank.orchestration.service.job;

import com.fasterxml.jackson.databind.JsonNode;

public interface JobQueue {

    String enqueue(String queueName, JsonNode payload, int priority);
}

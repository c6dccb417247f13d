package com.valuerank.orchestration.service.audit;

import java.util.Map;

public interface AuditSink {

    void record(String action, String actorId, String entityId, String entityType, Map<String, Object> metadata);
}

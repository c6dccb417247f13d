package com.valuerank.orchestration.service.aggregate;

import java.util.List;

public record AggregateUpdate(
    String aggregateRunId,
    boolean created,
    List<String> sourceRunIds,
    int runCount,
    int transcriptCount
) {
}

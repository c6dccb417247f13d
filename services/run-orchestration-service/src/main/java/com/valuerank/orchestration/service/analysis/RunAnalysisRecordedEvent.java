package com.valuerank.orchestration.service.analysis;

public record RunAnalysisRecordedEvent(
    String runId,
    String definitionId,
    String preambleVersionId,
    Integer definitionVersion
) {
}

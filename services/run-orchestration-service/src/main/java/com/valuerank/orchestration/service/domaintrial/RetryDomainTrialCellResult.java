package com.valuerank.orchestration.service.domaintrial;

public record RetryDomainTrialCellResult(
    boolean success,
    String definitionId,
    String modelId,
    String runId,
    String message
) {
}

package com.valuerank.orchestration.service.domaintrial;

import java.util.List;

public record DomainTrialRunResult(
    boolean success,
    int totalDefinitions,
    int targetedDefinitions,
    int startedRuns,
    int failedDefinitions,
    int skippedForBudget,
    double projectedCostUsd,
    boolean blockedByActiveLaunch,
    List<Entry> runs
) {
    public DomainTrialRunResult {
        runs = runs == null ? List.of() : List.copyOf(runs);
    }

    static DomainTrialRunResult empty() {
        return new DomainTrialRunResult(true, 0, 0, 0, 0, 0, 0.0, false, List.of());
    }

    public record Entry(String definitionId, String runId, List<String> modelIds) {
    }
}

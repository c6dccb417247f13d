package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.domain.RunProgress;
import com.valuerank.orchestration.domain.RunStatus;
import java.time.Instant;

public record RunResponse(
    String id,
    String name,
    String definitionId,
    String experimentId,
    RunStatus status,
    boolean aggregate,
    ProgressView progress,
    RunConfig config,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
    public record ProgressView(int total, int completed, int failed, int percentComplete) {
    }

    static RunResponse of(RunEntity run) {
        RunProgress progress = run.getProgress();
        return new RunResponse(
            run.getId(),
            run.getName(),
            run.getDefinitionId(),
            run.getExperimentId(),
            run.getStatus(),
            run.isAggregate(),
            new ProgressView(progress.getTotal(), progress.getCompleted(), progress.getFailed(), progress.percentComplete()),
            run.getConfig(),
            run.getCreatedAt(),
            run.getStartedAt(),
            run.getCompletedAt());
    }
}

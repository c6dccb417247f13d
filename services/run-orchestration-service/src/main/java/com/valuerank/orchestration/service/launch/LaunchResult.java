package com.valuerank.orchestration.service.launch;

import com.valuerank.orchestration.domain.RunEntity;

public record LaunchResult(
    RunEntity run,
    int jobCount,
    Double estimatedCostUsd
) {
}

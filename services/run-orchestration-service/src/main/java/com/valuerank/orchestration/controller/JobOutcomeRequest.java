package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.domain.JobStatus;
import jakarta.validation.constraints.NotNull;

public record JobOutcomeRequest(
    @NotNull(message = "status is required")
    JobStatus status,

    String error
) {
}

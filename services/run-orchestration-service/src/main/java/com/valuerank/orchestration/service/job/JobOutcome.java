package com.valuerank.orchestration.service.job;

import com.valuerank.orchestration.domain.JobStatus;

public record JobOutcome(
    String jobId,
    String runId,
    JobStatus status,
    int attempts,
    String errorCode
) {
}

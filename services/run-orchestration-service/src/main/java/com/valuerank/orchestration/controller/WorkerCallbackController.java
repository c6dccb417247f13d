package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.service.job.JobOutcome;
import com.valuerank.orchestration.service.job.JobOutcomeService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/jobs")
public class WorkerCallbackController {

    private final JobOutcomeService jobOutcomeService;

    public WorkerCallbackController(JobOutcomeService jobOutcomeService) {
        this.jobOutcomeService = jobOutcomeService;
    }

    @PostMapping("/{jobId}/outcome")
    public JobOutcome recordOutcome(@PathVariable String jobId, @Valid @RequestBody JobOutcomeRequest request) {
        return switch (request.status()) {
            case SUCCESS -> jobOutcomeService.recordSuccess(jobId);
            case FAILED -> jobOutcomeService.recordFailure(jobId, request.error());
            case QUEUED -> throw new IllegalArgumentException("Outcome status must be SUCCESS or FAILED");
        };
    }
}

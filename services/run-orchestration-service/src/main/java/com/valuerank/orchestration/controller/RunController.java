package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.service.launch.LaunchRequest;
import com.valuerank.orchestration.service.launch.LaunchResult;
import com.valuerank.orchestration.service.launch.RunLaunchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/runs")
public class RunController {

    private final RunLaunchService runLaunchService;
    private final RunRepository runRepository;

    public RunController(RunLaunchService runLaunchService, RunRepository runRepository) {
        this.runLaunchService = runLaunchService;
        this.runRepository = runRepository;
    }

    @PostMapping
    public ResponseEntity<LaunchRunResponse> launch(
        @Valid @RequestBody LaunchRunRequest request,
        @RequestHeader(name = RequestHeaders.USER_ID, required = false) String userId
    ) {
        LaunchResult result = runLaunchService.launch(new LaunchRequest(
            request.definitionId(),
            request.models(),
            request.samplePercentage(),
            request.sampleSeed(),
            request.temperature(),
            request.priority(),
            Boolean.TRUE.equals(request.finalTrial()),
            request.experimentId(),
            userId,
            request.scenarioIds()));
        return ResponseEntity.status(HttpStatus.CREATED).body(
            new LaunchRunResponse(RunResponse.of(result.run()), result.jobCount(), result.estimatedCostUsd()));
    }

    @GetMapping("/{runId}")
    public RunResponse getRun(@PathVariable String runId) {
        RunEntity run = runRepository.findById(runId)
            .filter(r -> !r.isDeleted())
            .orElseThrow(() -> new NotFoundException("Run", runId));
        return RunResponse.of(run);
    }
}

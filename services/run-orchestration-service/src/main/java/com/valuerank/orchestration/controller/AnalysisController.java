package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.domain.AnalysisType;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.service.analysis.AnalysisResultService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/runs/{runId}/analysis")
public class AnalysisController {

    private final AnalysisResultService analysisResultService;

    public AnalysisController(AnalysisResultService analysisResultService) {
        this.analysisResultService = analysisResultService;
    }

    @PostMapping
    public ResponseEntity<AnalysisResultResponse> record(
        @PathVariable String runId,
        @Valid @RequestBody RecordAnalysisRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(AnalysisResultResponse.of(
            analysisResultService.recordRunAnalysis(runId, request.output(), request.codeVersion())));
    }

    @GetMapping
    public AnalysisResultResponse current(
        @PathVariable String runId,
        @RequestParam(name = "type", defaultValue = "BASIC") AnalysisType type
    ) {
        return analysisResultService.currentFor(runId, type)
            .map(AnalysisResultResponse::of)
            .orElseThrow(() -> new NotFoundException("AnalysisResult", runId));
    }
}

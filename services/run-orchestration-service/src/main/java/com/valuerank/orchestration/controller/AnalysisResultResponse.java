package com.valuerank.orchestration.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.valuerank.orchestration.domain.AnalysisResultEntity;
import com.valuerank.orchestration.domain.AnalysisStatus;
import com.valuerank.orchestration.domain.AnalysisType;
import java.time.Instant;

public record AnalysisResultResponse(
    String id,
    String runId,
    AnalysisType analysisType,
    AnalysisStatus status,
    String codeVersion,
    String inputHash,
    JsonNode output,
    Instant createdAt
) {
    static AnalysisResultResponse of(AnalysisResultEntity entity) {
        return new AnalysisResultResponse(
            entity.getId(),
            entity.getRunId(),
            entity.getAnalysisType(),
            entity.getStatus(),
            entity.getCodeVersion(),
            entity.getInputHash(),
            entity.getOutput(),
            entity.getCreatedAt());
    }
}

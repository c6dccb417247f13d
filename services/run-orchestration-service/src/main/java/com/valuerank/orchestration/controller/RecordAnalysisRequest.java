package com.valuerank.orchestration.controller;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

public record RecordAnalysisRequest(
    @NotNull(message = "output is required")
    JsonNode output,

    String codeVersion
) {
}

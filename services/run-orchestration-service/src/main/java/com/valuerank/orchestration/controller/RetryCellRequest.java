package com.valuerank.orchestration.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

public record RetryCellRequest(
    @NotBlank(message = "definitionId is required")
    String definitionId,

    @NotBlank(message = "modelId is required")
    String modelId,

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    Double temperature
) {
}

package com.valuerank.orchestration.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record LaunchRunRequest(
    @NotBlank(message = "definitionId is required")
    String definitionId,

    @NotEmpty(message = "models must not be empty")
    List<String> models,

    @Min(1)
    @Max(100)
    Integer samplePercentage,

    Long sampleSeed,

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    Double temperature,

    String priority,

    Boolean finalTrial,

    String experimentId,

    List<String> scenarioIds
) {
}

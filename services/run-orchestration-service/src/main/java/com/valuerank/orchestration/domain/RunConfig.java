package com.valuerank.orchestration.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunConfig(
    List<String> models,
    Integer samplePercentage,
    Long sampleSeed,
    Double temperature,
    String priority,
    boolean finalTrial,
    String runMode,
    List<String> scenarioIds,
    Double estimatedCostUsd,
    DefinitionSnapshot definitionSnapshot,
    Boolean aggregate,
    List<String> sourceRunIds,
    Integer transcriptCount
) {
    public static final String MODE_PERCENTAGE = "PERCENTAGE";
    public static final String MODE_SPECIFIC = "SPECIFIC_CONDITION";
    public static final String MODE_FINAL = "FINAL";

    public RunConfig {
        models = models == null ? List.of() : List.copyOf(models);
        scenarioIds = scenarioIds == null ? null : List.copyOf(scenarioIds);
        sourceRunIds = sourceRunIds == null ? null : List.copyOf(sourceRunIds);
    }

    @JsonIgnore
    public String preambleVersionId() {
        return definitionSnapshot == null ? null : definitionSnapshot.preambleVersionId();
    }

    @JsonIgnore
    public Integer definitionVersion() {
        return definitionSnapshot == null ? null : definitionSnapshot.definitionVersion();
    }

    public boolean matchesSnapshot(String preambleVersionId, Integer definitionVersion) {
        if (!Objects.equals(preambleVersionId(), preambleVersionId)) {
            return false;
        }
        return definitionVersion == null || Objects.equals(definitionVersion(), definitionVersion);
    }

    public RunConfig asAggregate(List<String> sourceRunIds, int transcriptCount) {
        return new RunConfig(
            models, samplePercentage, sampleSeed, temperature, priority, false, runMode, scenarioIds,
            estimatedCostUsd, definitionSnapshot, Boolean.TRUE, sourceRunIds, transcriptCount);
    }
}

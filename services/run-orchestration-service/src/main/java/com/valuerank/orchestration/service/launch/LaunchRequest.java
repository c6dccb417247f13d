package com.valuerank.orchestration.service.launch;

import java.util.List;

public record LaunchRequest(
    String definitionId,
    List<String> models,
    Integer samplePercentage,
    Long sampleSeed,
    Double temperature,
    String priority,
    boolean finalTrial,
    String experimentId,
    String userId,
    List<String> scenarioIds
) {
    public LaunchRequest {
        models = models == null ? List.of() : List.copyOf(models);
        scenarioIds = scenarioIds == null ? List.of() : List.copyOf(scenarioIds);
    }

    public static LaunchRequest of(String definitionId, List<String> models, String userId) {
        return new LaunchRequest(definitionId, models, null, null, null, null, false, null, userId, null);
    }

    public static LaunchRequest finalTrial(
        String definitionId,
        List<String> models,
        Double temperature,
        String experimentId,
        String userId
    ) {
        return new LaunchRequest(definitionId, models, null, null, temperature, null, true, experimentId, userId, null);
    }
}

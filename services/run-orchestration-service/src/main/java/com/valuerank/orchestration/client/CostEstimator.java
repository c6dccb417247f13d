package com.valuerank.orchestration.client;

import java.util.List;

public interface CostEstimator {

    CostEstimate estimate(String definitionId, List<String> modelIds, int samplePercentage, int samplesPerScenario);
}

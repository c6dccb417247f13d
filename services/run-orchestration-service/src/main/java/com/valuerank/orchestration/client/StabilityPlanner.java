package com.valuerank.orchestration.client;

import java.util.List;

public interface StabilityPlanner {

    StabilityPlan planFinalTrial(String definitionId, List<String> modelIds);
}

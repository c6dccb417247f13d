package com.valuerank.orchestration.client;

import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HttpStabilityPlanner implements StabilityPlanner {

    private final RestClient restClient;

    public HttpStabilityPlanner(@Qualifier("stabilityPlannerRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public StabilityPlan planFinalTrial(String definitionId, List<String> modelIds) {
        return restClient.post()
            .uri("/v1/stability/plan")
            .contentType(MediaType.APPLICATION_JSON)
            .body(new PlanRequest(definitionId, modelIds))
            .retrieve()
            .body(StabilityPlan.class);
    }

    record PlanRequest(String definitionId, List<String> modelIds) {
    }
}

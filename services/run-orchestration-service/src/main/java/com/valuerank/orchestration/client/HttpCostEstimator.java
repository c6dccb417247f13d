package com.valuerank.orchestration.client;

import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HttpCostEstimator implements CostEstimator {

    private final RestClient restClient;

    public HttpCostEstimator(@Qualifier("costEstimatorRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public CostEstimate estimate(String definitionId, List<String> modelIds, int samplePercentage, int samplesPerScenario) {
        return restClient.post()
            .uri("/v1/cost/estimate")
            .contentType(MediaType.APPLICATION_JSON)
            .body(new EstimateRequest(definitionId, modelIds, samplePercentage, samplesPerScenario))
            .retrieve()
            .body(CostEstimate.class);
    }

    record EstimateRequest(String definitionId, List<String> modelIds, int samplePercentage, int samplesPerScenario) {
    }
}

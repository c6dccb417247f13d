package com.valuerank.orchestration.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CostEstimate(double total, List<ModelCost> perModel) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelCost(String modelId, double totalCost) {
    }
}

package com.valuerank.orchestration.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StabilityPlan(int totalJobs) {
}

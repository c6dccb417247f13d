package com.valuerank.orchestration.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    @Bean
    RestClient costEstimatorRestClient(OrchestratorProperties properties) {
        return RestClient.builder()
            .baseUrl(properties.getCostEstimatorBaseUrl())
            .build();
    }

    @Bean
    RestClient stabilityPlannerRestClient(OrchestratorProperties properties) {
        return RestClient.builder()
            .baseUrl(properties.getStabilityPlannerBaseUrl())
            .build();
    }
}

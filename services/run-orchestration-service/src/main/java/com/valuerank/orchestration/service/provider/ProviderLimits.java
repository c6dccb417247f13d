package com.valuerank.orchestration.service.provider;

public record ProviderLimits(
    int maxParallelRequests,
    int requestsPerMinute,
    String queueName
) {
    static final String QUEUE_PREFIX = "probe_";

    static String queueNameOf(String providerName) {
        return QUEUE_PREFIX + providerName;
    }
}

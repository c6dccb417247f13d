package com.valuerank.orchestration.service.provider;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

record ProviderSnapshot(
    Map<String, ProviderLimits> limitsByProvider,
    Map<String, String> providerByModel,
    Instant loadedAt
) {
    ProviderSnapshot {
        limitsByProvider = Map.copyOf(limitsByProvider);
        providerByModel = Map.copyOf(providerByModel);
    }

    boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(loadedAt.plus(ttl));
    }
}

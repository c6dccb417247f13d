package com.valuerank.orchestration.service.provider;

import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.domain.LlmProviderEntity;
import com.valuerank.orchestration.repository.LlmModelRepository;
import com.valuerank.orchestration.repository.LlmProviderRepository;
import com.valuerank.orchestration.repository.ModelProviderRow;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProviderRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderRouter.class);

    private final LlmProviderRepository providerRepository;
    private final LlmModelRepository modelRepository;
    private final OrchestratorProperties properties;
    private final Clock clock;
    private final AtomicReference<ProviderSnapshot> snapshot = new AtomicReference<>();

    public ProviderRouter(
        LlmProviderRepository providerRepository,
        LlmModelRepository modelRepository,
        OrchestratorProperties properties,
        Clock clock
    ) {
        this.providerRepository = providerRepository;
        this.modelRepository = modelRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public String queueNameFor(String modelId) {
        String providerName = currentSnapshot().providerByModel().get(modelId);
        if (providerName == null) {
            Optional<String> stored = modelRepository.findProviderNameByModelId(modelId);
            if (stored.isEmpty()) {
                LOGGER.warn("No provider mapped for model {}, using default queue {}", modelId, properties.getDefaultQueueName());
                return properties.getDefaultQueueName();
            }
            providerName = stored.get();
        }
        return ProviderLimits.queueNameOf(providerName);
    }

    public ProviderLimits limitsFor(String providerName) {
        return currentSnapshot().limitsByProvider().get(providerName);
    }

    public List<ProviderLimits> allProviderQueues() {
        List<ProviderLimits> queues = new ArrayList<>(currentSnapshot().limitsByProvider().values());
        queues.sort(Comparator.comparing(ProviderLimits::queueName));
        return queues;
    }

    public void clearCache() {
        snapshot.set(null);
        LOGGER.info("Provider cache cleared");
    }

    private ProviderSnapshot currentSnapshot() {
        ProviderSnapshot current = snapshot.get();
        if (current != null && !current.isExpired(clock.instant(), properties.getProviderCacheTtl())) {
            return current;
        }
        ProviderSnapshot loaded = load();
        snapshot.set(loaded);
        return loaded;
    }

    private ProviderSnapshot load() {
        Map<String, ProviderLimits> limits = new HashMap<>();
        for (LlmProviderEntity provider : providerRepository.findByEnabledTrue()) {
            limits.put(provider.getName(), new ProviderLimits(
                provider.getMaxParallelRequests(),
                provider.getRequestsPerMinute(),
                ProviderLimits.queueNameOf(provider.getName())));
        }
        Map<String, String> providerByModel = new HashMap<>();
        for (ModelProviderRow row : modelRepository.findModelProviders()) {
            providerByModel.put(row.getModelId(), row.getProviderName());
        }
        LOGGER.debug("Loaded {} providers and {} model mappings", limits.size(), providerByModel.size());
        return new ProviderSnapshot(limits, providerByModel, clock.instant());
    }
}

package com.valuerank.orchestration.service.aggregate;

import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.service.sampling.AdaptiveSamplingController;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

@Service
public class AggregateAnalysisCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateAnalysisCoordinator.class);

    private final AggregateAnalysisService aggregateAnalysisService;
    private final AdaptiveSamplingController adaptiveSamplingController;
    private final RunRepository runRepository;
    private final Executor executor;

    public AggregateAnalysisCoordinator(
        AggregateAnalysisService aggregateAnalysisService,
        AdaptiveSamplingController adaptiveSamplingController,
        RunRepository runRepository,
        @Qualifier("orchestrationExecutor") Executor executor
    ) {
        this.aggregateAnalysisService = aggregateAnalysisService;
        this.adaptiveSamplingController = adaptiveSamplingController;
        this.runRepository = runRepository;
        this.executor = executor;
    }

    public List<AggregateUpdate> aggregate(String definitionId, String preambleVersionId, Integer definitionVersion) {
        List<Integer> versions = definitionVersion != null
            ? List.of(definitionVersion)
            : deriveVersions(definitionId, preambleVersionId);
        if (versions.isEmpty()) {
            LOGGER.warn("No definition versions found for definition {} (preamble={}); skipping aggregation",
                definitionId, preambleVersionId);
            return List.of();
        }

        List<AggregateUpdate> updates = new ArrayList<>();
        for (Integer version : versions) {
            aggregateAnalysisService.updateAggregate(definitionId, preambleVersionId, version).ifPresent(updates::add);
        }

        try {
            executor.execute(() ->
                adaptiveSamplingController.continueAfterAggregate(definitionId, preambleVersionId, definitionVersion));
        } catch (TaskRejectedException ex) {
            LOGGER.error("Adaptive sampling check for definition {} was rejected by the executor", definitionId, ex);
        }
        LOGGER.info("Aggregate analysis completed for definition {}: {} aggregate(s) updated", definitionId, updates.size());
        return updates;
    }

    private List<Integer> deriveVersions(String definitionId, String preambleVersionId) {
        return runRepository.findCompletedSourceRuns(definitionId, Pageable.unpaged()).stream()
            .map(RunEntity::getConfig)
            .filter(Objects::nonNull)
            .filter(config -> Objects.equals(config.preambleVersionId(), preambleVersionId))
            .map(RunConfig::definitionVersion)
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .toList();
    }
}

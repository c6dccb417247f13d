package com.valuerank.orchestration.service.sampling;

import com.valuerank.orchestration.client.StabilityPlan;
import com.valuerank.orchestration.client.StabilityPlanner;
import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.service.launch.LaunchRequest;
import com.valuerank.orchestration.service.launch.LaunchResult;
import com.valuerank.orchestration.service.launch.RunLaunchService;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

@Component
public class AdaptiveSamplingController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdaptiveSamplingController.class);

    static final String SYSTEM_USER = "system";

    private final RunRepository runRepository;
    private final StabilityPlanner stabilityPlanner;
    private final RunLaunchService runLaunchService;
    private final OrchestratorProperties properties;

    public AdaptiveSamplingController(
        RunRepository runRepository,
        StabilityPlanner stabilityPlanner,
        RunLaunchService runLaunchService,
        OrchestratorProperties properties
    ) {
        this.runRepository = runRepository;
        this.stabilityPlanner = stabilityPlanner;
        this.runLaunchService = runLaunchService;
        this.properties = properties;
    }

    public Optional<LaunchResult> continueAfterAggregate(String definitionId, String preambleVersionId, Integer definitionVersion) {
        try {
            List<RunEntity> finalTrials = runRepository
                .findCompletedSourceRuns(definitionId, PageRequest.of(0, properties.getFinalTrialHistoryLimit()))
                .stream()
                .filter(run -> run.getConfig() != null
                    && run.getConfig().finalTrial()
                    && run.getConfig().matchesSnapshot(preambleVersionId, definitionVersion))
                .toList();
            if (finalTrials.isEmpty()) {
                return Optional.empty();
            }

            Set<String> modelIds = new LinkedHashSet<>();
            finalTrials.forEach(run -> modelIds.addAll(run.getConfig().models()));
            if (modelIds.isEmpty()) {
                return Optional.empty();
            }

            LOGGER.info("Checking adaptive sampling stability for definition {} with models {}", definitionId, modelIds);
            StabilityPlan plan = stabilityPlanner.planFinalTrial(definitionId, List.copyOf(modelIds));
            if (plan == null || plan.totalJobs() <= 0) {
                LOGGER.info("Stability criteria met or cap reached for definition {}. Final trial complete.", definitionId);
                return Optional.empty();
            }

            RunEntity newest = finalTrials.get(0);
            String userId = newest.getCreatedByUserId() == null ? SYSTEM_USER : newest.getCreatedByUserId();
            LOGGER.info("Stability criteria not met for definition {} ({} jobs planned). Starting follow-up final trial.",
                definitionId, plan.totalJobs());
            LaunchResult launched = runLaunchService.launch(LaunchRequest.finalTrial(
                definitionId, List.copyOf(modelIds), null, newest.getExperimentId(), userId));
            return Optional.of(launched);
        } catch (RuntimeException ex) {
            LOGGER.error("Error in adaptive sampling continuation for definition {}", definitionId, ex);
            return Optional.empty();
        }
    }
}

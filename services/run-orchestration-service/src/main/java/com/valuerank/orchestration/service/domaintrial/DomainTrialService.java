package com.valuerank.orchestration.service.domaintrial;

import com.valuerank.orchestration.client.CostEstimate;
import com.valuerank.orchestration.client.CostEstimator;
import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.domain.DefinitionEntity;
import com.valuerank.orchestration.domain.DomainEntity;
import com.valuerank.orchestration.domain.LlmModelEntity;
import com.valuerank.orchestration.domain.ModelStatus;
import com.valuerank.orchestration.domain.Priority;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.domain.RunStatus;
import com.valuerank.orchestration.error.AuthenticationRequiredException;
import com.valuerank.orchestration.error.ConflictException;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.error.TransientException;
import com.valuerank.orchestration.error.ValidationException;
import com.valuerank.orchestration.repository.DefinitionRepository;
import com.valuerank.orchestration.repository.DomainRepository;
import com.valuerank.orchestration.repository.LlmModelRepository;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.service.audit.AuditSink;
import com.valuerank.orchestration.service.launch.LaunchRequest;
import com.valuerank.orchestration.service.launch.LaunchResult;
import com.valuerank.orchestration.service.launch.RunLaunchService;
import com.valuerank.orchestration.service.lineage.LineageResolver;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class DomainTrialService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DomainTrialService.class);

    static final String RUN_TRIALS_ACTION = "run-trials-for-domain";
    static final String RETRY_CELL_ACTION = "retry-domain-trial-cell";
    private static final String ENTITY_TYPE = "Domain";

    private final DomainRepository domainRepository;
    private final DefinitionRepository definitionRepository;
    private final LlmModelRepository modelRepository;
    private final RunRepository runRepository;
    private final LineageResolver lineageResolver;
    private final RunLaunchService runLaunchService;
    private final CostEstimator costEstimator;
    private final AuditSink auditSink;
    private final OrchestratorProperties properties;
    private final Executor executor;

    public DomainTrialService(
        DomainRepository domainRepository,
        DefinitionRepository definitionRepository,
        LlmModelRepository modelRepository,
        RunRepository runRepository,
        LineageResolver lineageResolver,
        RunLaunchService runLaunchService,
        CostEstimator costEstimator,
        AuditSink auditSink,
        OrchestratorProperties properties,
        @Qualifier("orchestrationExecutor") Executor executor
    ) {
        this.domainRepository = domainRepository;
        this.definitionRepository = definitionRepository;
        this.modelRepository = modelRepository;
        this.runRepository = runRepository;
        this.lineageResolver = lineageResolver;
        this.runLaunchService = runLaunchService;
        this.costEstimator = costEstimator;
        this.auditSink = auditSink;
        this.properties = properties;
        this.executor = executor;
    }

    public DomainTrialRunResult runTrialsForDomain(String domainId, Double temperature, Double maxBudgetUsd, String userId) {
        requireUser(userId);
        DomainEntity domain = domainRepository.findById(domainId)
            .orElseThrow(() -> new NotFoundException("Domain", domainId));

        List<DefinitionEntity> definitions = definitionRepository.findByDomainIdAndDeletedAtIsNull(domainId);
        if (definitions.isEmpty()) {
            LOGGER.info("Domain {} has no definitions, nothing to launch", domainId);
            return DomainTrialRunResult.empty();
        }

        List<DefinitionEntity> latest = lineageResolver.latestPerLineage(definitions);
        List<String> latestIds = latest.stream().map(DefinitionEntity::getId).toList();

        List<LlmModelEntity> activeModels = modelRepository.findByStatus(ModelStatus.ACTIVE);
        List<String> defaultModels = activeModels.stream().filter(LlmModelEntity::isDefault)
            .map(LlmModelEntity::getModelId).sorted().toList();
        List<String> models = defaultModels.isEmpty()
            ? activeModels.stream().map(LlmModelEntity::getModelId).sorted().toList()
            : defaultModels;
        if (models.isEmpty()) {
            throw new ValidationException(
                "No active models are configured. Add an active model before running domain trials.");
        }

        List<String> normalizedModels = ModelSets.normalize(models);
        boolean blocked = runRepository.findByDefinitionsAndStatuses(latestIds, RunStatus.ACTIVE).stream()
            .anyMatch(run -> ModelSets.isEquivalent(run, normalizedModels, temperature));
        if (blocked) {
            throw new ConflictException(
                "Domain trial launch blocked: matching domain trials are already active for this domain and temperature.");
        }

        if (maxBudgetUsd != null && maxBudgetUsd <= 0) {
            throw new ValidationException("maxBudgetUsd must be greater than 0 when provided.");
        }

        Map<String, Double> estimates = new HashMap<>();
        if (maxBudgetUsd != null) {
            for (DefinitionEntity definition : latest) {
                estimates.put(definition.getId(), estimateTotal(definition.getId(), models));
            }
        }

        int batchSize = Math.max(1, properties.getDomainTrialBatchSize());
        int startedRuns = 0;
        int failedDefinitions = 0;
        int skippedForBudget = 0;
        double projectedCostUsd = 0.0;
        List<DomainTrialRunResult.Entry> runs = new ArrayList<>();

        for (int offset = 0; offset < latest.size(); offset += batchSize) {
            List<DefinitionEntity> batch = latest.subList(offset, Math.min(latest.size(), offset + batchSize));
            List<DefinitionEntity> launchable = new ArrayList<>();
            for (DefinitionEntity definition : batch) {
                if (maxBudgetUsd != null) {
                    double estimate = estimates.get(definition.getId());
                    if (projectedCostUsd + estimate > maxBudgetUsd) {
                        skippedForBudget++;
                        continue;
                    }
                    projectedCostUsd += estimate;
                }
                launchable.add(definition);
            }
            if (launchable.isEmpty()) {
                continue;
            }

            Map<DefinitionEntity, CompletableFuture<LaunchResult>> launches = new LinkedHashMap<>();
            for (DefinitionEntity definition : launchable) {
                LaunchRequest request = new LaunchRequest(
                    definition.getId(),
                    models,
                    properties.getDomainTrialSamplePercentage(),
                    null,
                    temperature,
                    Priority.NORMAL.name(),
                    false,
                    null,
                    userId,
                    null);
                launches.put(definition, CompletableFuture.supplyAsync(() -> runLaunchService.launch(request), executor));
            }

            for (Map.Entry<DefinitionEntity, CompletableFuture<LaunchResult>> launch : launches.entrySet()) {
                try {
                    RunEntity run = launch.getValue().join().run();
                    startedRuns++;
                    runs.add(new DomainTrialRunResult.Entry(run.getDefinitionId(), run.getId(), models));
                } catch (CompletionException ex) {
                    failedDefinitions++;
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    LOGGER.error("Failed to start domain trial for definition {} in domain {}: {}",
                        launch.getKey().getId(), domainId, cause.getMessage(), cause);
                }
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("operationType", RUN_TRIALS_ACTION);
        metadata.put("domainName", domain.getName());
        metadata.put("totalDefinitions", definitions.size());
        metadata.put("targetedDefinitions", latest.size());
        metadata.put("startedRuns", startedRuns);
        metadata.put("failedDefinitions", failedDefinitions);
        metadata.put("skippedForBudget", skippedForBudget);
        metadata.put("projectedCostUsd", projectedCostUsd);
        metadata.put("blockedByActiveLaunch", false);
        metadata.put("models", models);
        metadata.put("temperature", temperature);
        metadata.put("maxBudgetUsd", maxBudgetUsd);
        metadata.put("defaultsOnly", !defaultModels.isEmpty());
        auditSink.record(RUN_TRIALS_ACTION, userId, domainId, ENTITY_TYPE, metadata);

        LOGGER.info("Domain {} trials: {} targeted, {} started, {} failed, {} skipped for budget (projected ${})",
            domainId, latest.size(), startedRuns, failedDefinitions, skippedForBudget, projectedCostUsd);
        return new DomainTrialRunResult(
            failedDefinitions == 0,
            definitions.size(),
            latest.size(),
            startedRuns,
            failedDefinitions,
            skippedForBudget,
            projectedCostUsd,
            false,
            runs);
    }

    public RetryDomainTrialCellResult retryDomainTrialCell(
        String domainId,
        String definitionId,
        String modelId,
        Double temperature,
        String userId
    ) {
        requireUser(userId);
        DomainEntity domain = domainRepository.findById(domainId)
            .orElseThrow(() -> new NotFoundException("Domain", domainId));
        definitionRepository.findByIdAndDomainIdAndDeletedAtIsNull(definitionId, domainId)
            .orElseThrow(() -> new ValidationException("Selected definition is not part of this domain."));
        modelRepository.findByModelIdAndStatus(modelId, ModelStatus.ACTIVE)
            .orElseThrow(() -> new ValidationException("Model is not active: " + modelId));

        List<String> single = ModelSets.normalize(List.of(modelId));
        boolean blocked = runRepository.findByDefinitionsAndStatuses(List.of(definitionId), RunStatus.ACTIVE).stream()
            .anyMatch(run -> ModelSets.isEquivalent(run, single, temperature));
        if (blocked) {
            throw new ConflictException(
                "Retry blocked: this model/definition cell already has an active run at the same temperature.");
        }

        LaunchResult launched = runLaunchService.launch(new LaunchRequest(
            definitionId,
            List.of(modelId),
            properties.getDomainTrialSamplePercentage(),
            null,
            temperature,
            Priority.NORMAL.name(),
            false,
            null,
            userId,
            null));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("operationType", RETRY_CELL_ACTION);
        metadata.put("domainName", domain.getName());
        metadata.put("definitionId", definitionId);
        metadata.put("modelId", modelId);
        metadata.put("runId", launched.run().getId());
        metadata.put("temperature", temperature);
        auditSink.record(RETRY_CELL_ACTION, userId, domainId, ENTITY_TYPE, metadata);

        return new RetryDomainTrialCellResult(true, definitionId, modelId, launched.run().getId(), null);
    }

    private double estimateTotal(String definitionId, List<String> models) {
        CostEstimate estimate;
        try {
            estimate = costEstimator.estimate(definitionId, models, properties.getDomainTrialSamplePercentage(), 1);
        } catch (RuntimeException ex) {
            throw new TransientException("Cost estimate failed for definition " + definitionId, ex);
        }
        return estimate == null ? 0.0 : estimate.total();
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationRequiredException();
        }
    }
}

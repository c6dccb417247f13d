package com.valuerank.orchestration.service.launch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.valuerank.orchestration.client.CostEstimate;
import com.valuerank.orchestration.client.CostEstimator;
import com.valuerank.orchestration.domain.DefinitionEntity;
import com.valuerank.orchestration.domain.DefinitionSnapshot;
import com.valuerank.orchestration.domain.LlmModelEntity;
import com.valuerank.orchestration.domain.ModelStatus;
import com.valuerank.orchestration.domain.Priority;
import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.error.TransientException;
import com.valuerank.orchestration.error.ValidationException;
import com.valuerank.orchestration.repository.DefinitionRepository;
import com.valuerank.orchestration.repository.ExperimentRepository;
import com.valuerank.orchestration.repository.LlmModelRepository;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.repository.ScenarioRepository;
import com.valuerank.orchestration.service.job.JobQueue;
import com.valuerank.orchestration.service.provider.ProviderRouter;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RunLaunchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunLaunchService.class);

    private static final double MIN_TEMPERATURE = 0.0;
    private static final double MAX_TEMPERATURE = 2.0;
    private static final int MAX_TURNS = 10;

    private final DefinitionRepository definitionRepository;
    private final ScenarioRepository scenarioRepository;
    private final ExperimentRepository experimentRepository;
    private final LlmModelRepository modelRepository;
    private final RunRepository runRepository;
    private final ProviderRouter providerRouter;
    private final JobQueue jobQueue;
    private final CostEstimator costEstimator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunLaunchService(
        DefinitionRepository definitionRepository,
        ScenarioRepository scenarioRepository,
        ExperimentRepository experimentRepository,
        LlmModelRepository modelRepository,
        RunRepository runRepository,
        ProviderRouter providerRouter,
        JobQueue jobQueue,
        CostEstimator costEstimator,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.definitionRepository = definitionRepository;
        this.scenarioRepository = scenarioRepository;
        this.experimentRepository = experimentRepository;
        this.modelRepository = modelRepository;
        this.runRepository = runRepository;
        this.providerRouter = providerRouter;
        this.jobQueue = jobQueue;
        this.costEstimator = costEstimator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public LaunchResult launch(LaunchRequest request) {
        LOGGER.info("Starting run for definition {} with {} models (samplePercentage={}, finalTrial={}, experimentId={})",
            request.definitionId(), request.models().size(), request.samplePercentage(), request.finalTrial(),
            request.experimentId());

        List<String> models = List.copyOf(new LinkedHashSet<>(request.models()));
        int samplePercentage = request.finalTrial() || request.samplePercentage() == null
            ? 100
            : request.samplePercentage();
        Priority priority = validate(request, models, samplePercentage);

        DefinitionEntity definition = definitionRepository.findByIdAndDeletedAtIsNull(request.definitionId())
            .orElseThrow(() -> new NotFoundException("Definition", request.definitionId()));

        List<String> eligible = scenarioRepository.findEligibleIds(definition.getId());
        if (eligible.isEmpty()) {
            throw new ValidationException("Definition " + definition.getId() + " has no scenarios");
        }

        boolean specific = !request.scenarioIds().isEmpty();
        long seed = request.sampleSeed() == null ? ScenarioSampler.seedFor(definition.getId()) : request.sampleSeed();
        List<String> selected = specific
            ? selectExplicit(definition.getId(), eligible, request.scenarioIds())
            : ScenarioSampler.sample(eligible, samplePercentage, seed);
        int jobCount = selected.size() * models.size();

        int estimatePercentage = specific
            ? (int) Math.max(1, Math.round(selected.size() * 100.0 / eligible.size()))
            : samplePercentage;
        Double estimatedCost = estimateCost(definition.getId(), models, estimatePercentage);

        RunConfig config = new RunConfig(
            models,
            request.finalTrial() ? null : samplePercentage,
            request.finalTrial() ? null : request.sampleSeed(),
            request.temperature(),
            priority.name(),
            request.finalTrial(),
            request.finalTrial() ? RunConfig.MODE_FINAL : specific ? RunConfig.MODE_SPECIFIC : RunConfig.MODE_PERCENTAGE,
            selected,
            estimatedCost,
            DefinitionSnapshot.of(definition),
            null,
            null,
            null);

        RunEntity run = runRepository.save(RunEntity.launch(
            nextRunName(definition.getId(), request.finalTrial()),
            definition.getId(),
            request.experimentId(),
            config,
            jobCount,
            request.userId()));

        enqueueJobs(run, selected, models, request.temperature(), priority);
        LOGGER.info("Run {} ({}) created for definition {}: {} scenarios x {} models = {} jobs",
            run.getId(), run.getName(), definition.getId(), selected.size(), models.size(), jobCount);
        return new LaunchResult(run, jobCount, estimatedCost);
    }

    private Priority validate(LaunchRequest request, List<String> models, int samplePercentage) {
        if (models.isEmpty()) {
            throw new ValidationException("At least one model must be specified");
        }
        if (!request.finalTrial() && (samplePercentage < 1 || samplePercentage > 100)) {
            throw new ValidationException("samplePercentage must be between 1 and 100");
        }
        if (request.temperature() != null
            && (request.temperature() < MIN_TEMPERATURE || request.temperature() > MAX_TEMPERATURE)) {
            throw new ValidationException("temperature must be between 0 and 2");
        }
        if (request.finalTrial() && !request.scenarioIds().isEmpty()) {
            throw new ValidationException("scenarioIds cannot be used with finalTrial");
        }
        Priority priority = request.priority() == null
            ? Priority.NORMAL
            : Priority.parse(request.priority()).orElseThrow(() -> new ValidationException(
                "Invalid priority: " + request.priority() + ". Must be one of: LOW, NORMAL, HIGH"));

        Set<String> active = new HashSet<>();
        for (LlmModelEntity model : modelRepository.findByModelIdInAndStatus(models, ModelStatus.ACTIVE)) {
            active.add(model.getModelId());
        }
        List<String> inactive = models.stream().filter(m -> !active.contains(m)).toList();
        if (!inactive.isEmpty()) {
            throw new ValidationException("The following models are not active or valid: " + String.join(", ", inactive));
        }

        if (request.experimentId() != null && !request.experimentId().isBlank()
            && !experimentRepository.existsById(request.experimentId())) {
            throw new NotFoundException("Experiment", request.experimentId());
        }
        return priority;
    }

    private List<String> selectExplicit(String definitionId, List<String> eligible, List<String> requested) {
        Set<String> eligibleSet = new HashSet<>(eligible);
        List<String> selected = List.copyOf(new LinkedHashSet<>(requested));
        List<String> invalid = selected.stream().filter(id -> !eligibleSet.contains(id)).toList();
        if (!invalid.isEmpty()) {
            throw new ValidationException(
                "Invalid scenarioIds for definition " + definitionId + ": " + String.join(", ", invalid));
        }
        return selected;
    }

    private Double estimateCost(String definitionId, List<String> models, int samplePercentage) {
        try {
            CostEstimate estimate = costEstimator.estimate(definitionId, models, samplePercentage, 1);
            return estimate == null ? null : estimate.total();
        } catch (RuntimeException ex) {
            LOGGER.warn("Cost estimate failed for definition {}, continuing without it: {}", definitionId, ex.getMessage());
            return null;
        }
    }

    private String nextRunName(String definitionId, boolean finalTrial) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        long runsToday = runRepository.countCreatedBetween(
            definitionId,
            today.atStartOfDay().toInstant(ZoneOffset.UTC),
            today.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC));
        return RunNames.nameFor(today, runsToday, finalTrial);
    }

    private void enqueueJobs(RunEntity run, List<String> scenarioIds, List<String> models, Double temperature, Priority priority) {
        Map<String, String> queueByModel = new HashMap<>();
        for (String modelId : models) {
            String queueName = queueByModel.computeIfAbsent(modelId, providerRouter::queueNameFor);
            for (String scenarioId : scenarioIds) {
                ObjectNode payload = objectMapper.createObjectNode()
                    .put("runId", run.getId())
                    .put("scenarioId", scenarioId)
                    .put("modelId", modelId)
                    .put("sampleIndex", 0);
                ObjectNode jobConfig = payload.putObject("config").put("maxTurns", MAX_TURNS);
                if (temperature != null) {
                    jobConfig.put("temperature", temperature);
                }
                try {
                    jobQueue.enqueue(queueName, payload, priority.queueValue());
                } catch (RuntimeException ex) {
                    throw new TransientException("Failed to enqueue jobs for run " + run.getId(), ex);
                }
            }
        }
    }
}

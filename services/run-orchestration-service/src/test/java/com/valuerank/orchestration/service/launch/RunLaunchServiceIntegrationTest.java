package com.valuerank.orchestration.service.launch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuerank.orchestration.client.CostEstimate;
import com.valuerank.orchestration.client.CostEstimator;
import com.valuerank.orchestration.client.StabilityPlanner;
import com.valuerank.orchestration.domain.DefinitionEntity;
import com.valuerank.orchestration.domain.ExperimentEntity;
import com.valuerank.orchestration.domain.LlmModelEntity;
import com.valuerank.orchestration.domain.LlmProviderEntity;
import com.valuerank.orchestration.domain.ModelStatus;
import com.valuerank.orchestration.domain.ProbeJobEntity;
import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.domain.RunStatus;
import com.valuerank.orchestration.domain.ScenarioEntity;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.error.ValidationException;
import com.valuerank.orchestration.repository.DefinitionRepository;
import com.valuerank.orchestration.repository.ExperimentRepository;
import com.valuerank.orchestration.repository.LlmModelRepository;
import com.valuerank.orchestration.repository.LlmProviderRepository;
import com.valuerank.orchestration.repository.ProbeJobRepository;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.repository.ScenarioRepository;
import com.valuerank.orchestration.service.provider.ProviderRouter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest
class RunLaunchServiceIntegrationTest {

    @Autowired
    private RunLaunchService runLaunchService;

    @Autowired
    private RunRepository runRepository;

    @Autowired
    private ProbeJobRepository probeJobRepository;

    @Autowired
    private DefinitionRepository definitionRepository;

    @Autowired
    private ScenarioRepository scenarioRepository;

    @Autowired
    private ExperimentRepository experimentRepository;

    @Autowired
    private LlmProviderRepository providerRepository;

    @Autowired
    private LlmModelRepository modelRepository;

    @Autowired
    private ProviderRouter providerRouter;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CostEstimator costEstimator;

    @MockBean
    private StabilityPlanner stabilityPlanner;

    private DefinitionEntity definition;
    private final List<String> scenarioIds = new ArrayList<>();

    @BeforeEach
    void setUp() {
        probeJobRepository.deleteAll();
        runRepository.deleteAll();
        scenarioRepository.deleteAll();
        definitionRepository.deleteAll();
        experimentRepository.deleteAll();
        modelRepository.deleteAll();
        providerRepository.deleteAll();
        providerRouter.clearCache();
        scenarioIds.clear();

        LlmProviderEntity openai = providerRepository.save(LlmProviderEntity.of("openai", 5, 60, true));
        LlmProviderEntity anthropic = providerRepository.save(LlmProviderEntity.of("anthropic", 3, 30, true));
        modelRepository.save(LlmModelEntity.of(openai.getId(), "gpt-4o", ModelStatus.ACTIVE, true));
        modelRepository.save(LlmModelEntity.of(anthropic.getId(), "claude-3", ModelStatus.ACTIVE, true));
        modelRepository.save(LlmModelEntity.of(openai.getId(), "gpt-3", ModelStatus.DEPRECATED, false));

        definition = definitionRepository.save(DefinitionEntity.create(
            "Trolley", null, "domain-1", 2, objectMapper.createObjectNode().put("preamble", "Decide.")));
        for (int i = 0; i < 9; i++) {
            scenarioIds.add(scenarioRepository.save(ScenarioEntity.of(definition.getId(), "scenario " + i)).getId());
        }

        when(costEstimator.estimate(anyString(), anyList(), anyInt(), anyInt()))
            .thenReturn(new CostEstimate(1.25, List.of()));
    }

    @Test
    void shouldCreateOneJobPerSampledScenarioAndModel() {
        LaunchRequest request = new LaunchRequest(
            definition.getId(), List.of("gpt-4o", "claude-3"), 50, 11L, 0.3, "HIGH", false, null, "alice", null);

        LaunchResult result = runLaunchService.launch(request);

        RunEntity run = runRepository.findById(result.run().getId()).orElseThrow();
        assertThat(result.jobCount()).isEqualTo(10);
        assertThat(result.estimatedCostUsd()).isEqualTo(1.25);
        assertThat(run.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(run.getProgress().getTotal()).isEqualTo(10);
        assertThat(run.getProgress().done()).isZero();
        assertThat(run.getName()).matches("[A-Z][a-z]{2} \\d{2}-A");
        assertThat(run.getCreatedByUserId()).isEqualTo("alice");

        RunConfig config = run.getConfig();
        assertThat(config.scenarioIds()).hasSize(5);
        assertThat(config.samplePercentage()).isEqualTo(50);
        assertThat(config.priority()).isEqualTo("HIGH");
        assertThat(config.runMode()).isEqualTo(RunConfig.MODE_PERCENTAGE);
        assertThat(config.definitionVersion()).isEqualTo(2);
        assertThat(config.definitionSnapshot().content().get("preamble").asText()).isEqualTo("Decide.");

        List<ProbeJobEntity> jobs = probeJobRepository.findByRunId(run.getId());
        assertThat(jobs).hasSize(10);
        assertThat(jobs).filteredOn(job -> job.getModelId().equals("gpt-4o"))
            .extracting(ProbeJobEntity::getQueueName).containsOnly("probe_openai");
        assertThat(jobs).filteredOn(job -> job.getModelId().equals("claude-3"))
            .extracting(ProbeJobEntity::getQueueName).containsOnly("probe_anthropic");
        assertThat(jobs).extracting(ProbeJobEntity::getScenarioId).containsOnlyElementsOf(config.scenarioIds());
        assertThat(jobs).allSatisfy(job -> {
            assertThat(job.getPriority()).isEqualTo(10);
            assertThat(job.getPayload().path("config").path("temperature").asDouble()).isEqualTo(0.3);
            assertThat(job.getPayload().path("config").path("maxTurns").asInt()).isEqualTo(10);
        });
    }

    @Test
    void shouldSampleSameScenariosForSameSeed() {
        LaunchRequest request = new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), 30, 5L, null, null, false, null, "alice", null);

        RunEntity first = runLaunchService.launch(request).run();
        RunEntity second = runLaunchService.launch(request).run();

        assertThat(first.getConfig().scenarioIds()).isEqualTo(second.getConfig().scenarioIds());
        assertThat(second.getName()).endsWith("-B");
    }

    @Test
    void shouldRunFinalTrialOverAllScenarios() {
        LaunchResult result = runLaunchService.launch(
            LaunchRequest.finalTrial(definition.getId(), List.of("gpt-4o"), null, null, "alice"));

        assertThat(result.jobCount()).isEqualTo(9);
        assertThat(result.run().getConfig().finalTrial()).isTrue();
        assertThat(result.run().getConfig().runMode()).isEqualTo(RunConfig.MODE_FINAL);
        assertThat(result.run().getName()).endsWith(" (Final)");
    }

    @Test
    void shouldLaunchExplicitScenarios() {
        LaunchRequest request = new LaunchRequest(definition.getId(), List.of("gpt-4o"), null, null, null, null, false,
            null, "alice", List.of(scenarioIds.get(0), scenarioIds.get(3)));

        LaunchResult result = runLaunchService.launch(request);

        assertThat(result.jobCount()).isEqualTo(2);
        assertThat(result.run().getConfig().runMode()).isEqualTo(RunConfig.MODE_SPECIFIC);
        assertThat(result.run().getConfig().scenarioIds()).containsExactly(scenarioIds.get(0), scenarioIds.get(3));
    }

    @Test
    void shouldContinueWithoutEstimateWhenEstimatorFails() {
        when(costEstimator.estimate(anyString(), anyList(), anyInt(), anyInt()))
            .thenThrow(new IllegalStateException("estimator down"));

        LaunchResult result = runLaunchService.launch(LaunchRequest.of(definition.getId(), List.of("gpt-4o"), "alice"));

        assertThat(result.estimatedCostUsd()).isNull();
        assertThat(result.jobCount()).isEqualTo(9);
    }

    @Test
    void shouldLinkExistingExperiment() {
        ExperimentEntity experiment = experimentRepository.save(ExperimentEntity.named("baseline"));
        LaunchRequest request = new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), 10, null, null, null, false, experiment.getId(), "alice", null);

        assertThat(runLaunchService.launch(request).run().getExperimentId()).isEqualTo(experiment.getId());
    }

    @Test
    void shouldRejectInvalidRequestsWithoutWriting() {
        assertThatThrownBy(() -> runLaunchService.launch(LaunchRequest.of(definition.getId(), List.of(), "alice")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> runLaunchService.launch(LaunchRequest.of(definition.getId(), List.of("gpt-3"), "alice")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("gpt-3");
        assertThatThrownBy(() -> runLaunchService.launch(new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), 0, null, null, null, false, null, "alice", null)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> runLaunchService.launch(new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), 50, null, 2.5, null, false, null, "alice", null)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> runLaunchService.launch(new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), 50, null, null, "URGENT", false, null, "alice", null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("URGENT");
        assertThatThrownBy(() -> runLaunchService.launch(new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), null, null, null, null, false, null, "alice", List.of("not-a-scenario"))))
            .isInstanceOf(ValidationException.class);

        assertThat(runRepository.count()).isZero();
        assertThat(probeJobRepository.count()).isZero();
    }

    @Test
    void shouldReportMissingDefinitionAndExperiment() {
        assertThatThrownBy(() -> runLaunchService.launch(LaunchRequest.of("missing", List.of("gpt-4o"), "alice")))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> runLaunchService.launch(new LaunchRequest(
            definition.getId(), List.of("gpt-4o"), 50, null, null, null, false, "no-such-experiment", "alice", null)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldTreatDeletedDefinitionAsMissing() {
        definition.markDeleted();
        definitionRepository.save(definition);

        assertThatThrownBy(() -> runLaunchService.launch(LaunchRequest.of(definition.getId(), List.of("gpt-4o"), "alice")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldRejectDefinitionWithoutScenarios() {
        DefinitionEntity empty = definitionRepository.save(DefinitionEntity.create("Empty", null, "domain-1", 1, null));

        assertThatThrownBy(() -> runLaunchService.launch(LaunchRequest.of(empty.getId(), List.of("gpt-4o"), "alice")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("no scenarios");
    }
}

package com.valuerank.orchestration.service.domaintrial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.valuerank.orchestration.client.CostEstimate;
import com.valuerank.orchestration.client.CostEstimator;
import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.domain.DefinitionEntity;
import com.valuerank.orchestration.domain.DomainEntity;
import com.valuerank.orchestration.domain.LlmModelEntity;
import com.valuerank.orchestration.domain.ModelStatus;
import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
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
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DomainTrialServiceTest {

    private static final String USER = "user-1";

    @Mock
    private DomainRepository domainRepository;

    @Mock
    private DefinitionRepository definitionRepository;

    @Mock
    private LlmModelRepository modelRepository;

    @Mock
    private RunRepository runRepository;

    @Mock
    private RunLaunchService runLaunchService;

    @Mock
    private CostEstimator costEstimator;

    @Mock
    private AuditSink auditSink;

    private final DomainEntity domain = DomainEntity.named("Ethics");
    private DomainTrialService service;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.setDomainTrialBatchSize(2);
        service = new DomainTrialService(
            domainRepository,
            definitionRepository,
            modelRepository,
            runRepository,
            new LineageResolver(definitionRepository),
            runLaunchService,
            costEstimator,
            auditSink,
            properties,
            Runnable::run);
    }

    @Test
    void shouldLaunchLatestDefinitionOfEachLineageWithDefaultModels() {
        DefinitionEntity root = DefinitionEntity.create("trolley", null, domain.getId(), 1, null);
        DefinitionEntity latest = DefinitionEntity.create("trolley v2", root.getId(), domain.getId(), 2, null);
        DefinitionEntity other = DefinitionEntity.create("lifeboat", null, domain.getId(), 1, null);
        givenDomain(root, latest, other);
        givenModels(
            LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true),
            LlmModelEntity.of("p2", "claude-3", ModelStatus.ACTIVE, true),
            LlmModelEntity.of("p2", "claude-instant", ModelStatus.ACTIVE, false));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());
        when(runLaunchService.launch(any())).thenAnswer(inv -> launched(inv.getArgument(0)));

        DomainTrialRunResult result = service.runTrialsForDomain(domain.getId(), 0.7, null, USER);

        assertThat(result.success()).isTrue();
        assertThat(result.totalDefinitions()).isEqualTo(3);
        assertThat(result.targetedDefinitions()).isEqualTo(2);
        assertThat(result.startedRuns()).isEqualTo(2);
        assertThat(result.runs()).extracting(DomainTrialRunResult.Entry::definitionId)
            .containsExactly(latest.getId(), other.getId());

        ArgumentCaptor<LaunchRequest> requests = ArgumentCaptor.forClass(LaunchRequest.class);
        verify(runLaunchService, times(2)).launch(requests.capture());
        assertThat(requests.getAllValues()).allSatisfy(request -> {
            assertThat(request.models()).containsExactly("claude-3", "gpt-4o");
            assertThat(request.temperature()).isEqualTo(0.7);
            assertThat(request.samplePercentage()).isEqualTo(100);
            assertThat(request.userId()).isEqualTo(USER);
        });
        verifyNoInteractions(costEstimator);
        verify(auditSink).record(eq(DomainTrialService.RUN_TRIALS_ACTION), eq(USER), eq(domain.getId()), eq("Domain"), anyMap());
    }

    @Test
    void shouldFallBackToAllActiveModelsWithoutDefaults() {
        DefinitionEntity definition = DefinitionEntity.create("trolley", null, domain.getId(), 1, null);
        givenDomain(definition);
        givenModels(
            LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, false),
            LlmModelEntity.of("p2", "claude-3", ModelStatus.ACTIVE, false));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());
        when(runLaunchService.launch(any())).thenAnswer(inv -> launched(inv.getArgument(0)));

        DomainTrialRunResult result = service.runTrialsForDomain(domain.getId(), null, null, USER);

        assertThat(result.runs().get(0).modelIds()).containsExactly("claude-3", "gpt-4o");
    }

    @Test
    void shouldSkipDefinitionsThatWouldExceedBudget() {
        DefinitionEntity first = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        DefinitionEntity expensive = DefinitionEntity.create("b", null, domain.getId(), 1, null);
        DefinitionEntity last = DefinitionEntity.create("c", null, domain.getId(), 1, null);
        givenDomain(first, expensive, last);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());
        givenEstimate(first, 5.0);
        givenEstimate(expensive, 12.0);
        givenEstimate(last, 5.0);
        when(runLaunchService.launch(any())).thenAnswer(inv -> launched(inv.getArgument(0)));

        DomainTrialRunResult result = service.runTrialsForDomain(domain.getId(), null, 10.0, USER);

        assertThat(result.startedRuns()).isEqualTo(2);
        assertThat(result.skippedForBudget()).isEqualTo(1);
        assertThat(result.projectedCostUsd()).isEqualTo(10.0);
        assertThat(result.runs()).extracting(DomainTrialRunResult.Entry::definitionId)
            .containsExactly(first.getId(), last.getId());
    }

    @Test
    void shouldRejectNonPositiveBudget() {
        DefinitionEntity definition = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        givenDomain(definition);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> service.runTrialsForDomain(domain.getId(), null, 0.0, USER))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("maxBudgetUsd");
        verifyNoInteractions(runLaunchService);
    }

    @Test
    void shouldFailWhenCostEstimateIsUnavailableUnderBudget() {
        DefinitionEntity definition = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        givenDomain(definition);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());
        when(costEstimator.estimate(anyString(), anyList(), anyInt(), anyInt()))
            .thenThrow(new IllegalStateException("estimator down"));

        assertThatThrownBy(() -> service.runTrialsForDomain(domain.getId(), null, 50.0, USER))
            .isInstanceOf(TransientException.class);
        verifyNoInteractions(runLaunchService);
    }

    @Test
    void shouldEstimateEveryDefinitionBeforeLaunchingAnyBatch() {
        DefinitionEntity first = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        DefinitionEntity second = DefinitionEntity.create("b", null, domain.getId(), 1, null);
        DefinitionEntity third = DefinitionEntity.create("c", null, domain.getId(), 1, null);
        givenDomain(first, second, third);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());
        givenEstimate(first, 1.0);
        givenEstimate(second, 1.0);
        when(costEstimator.estimate(eq(third.getId()), anyList(), eq(100), eq(1)))
            .thenThrow(new IllegalStateException("estimator down"));

        assertThatThrownBy(() -> service.runTrialsForDomain(domain.getId(), null, 50.0, USER))
            .isInstanceOf(TransientException.class)
            .hasMessageContaining(third.getId());
        verifyNoInteractions(runLaunchService, auditSink);
    }

    @Test
    void shouldBlockWhenEquivalentTrialIsActive() {
        DefinitionEntity definition = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        givenDomain(definition);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any()))
            .thenReturn(List.of(activeRun(definition.getId(), List.of(" GPT-4o"), 0.5)));

        assertThatThrownBy(() -> service.runTrialsForDomain(domain.getId(), 0.5, null, USER))
            .isInstanceOf(ConflictException.class);
        verifyNoInteractions(runLaunchService, auditSink);
    }

    @Test
    void shouldNotBlockOnActiveTrialAtDifferentTemperature() {
        DefinitionEntity definition = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        givenDomain(definition);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any()))
            .thenReturn(List.of(activeRun(definition.getId(), List.of("gpt-4o"), null)));
        when(runLaunchService.launch(any())).thenAnswer(inv -> launched(inv.getArgument(0)));

        DomainTrialRunResult result = service.runTrialsForDomain(domain.getId(), 0.5, null, USER);

        assertThat(result.startedRuns()).isEqualTo(1);
    }

    @Test
    void shouldCountFailedLaunchesWithoutAbortingOthers() {
        DefinitionEntity broken = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        DefinitionEntity healthy = DefinitionEntity.create("b", null, domain.getId(), 1, null);
        DefinitionEntity third = DefinitionEntity.create("c", null, domain.getId(), 1, null);
        givenDomain(broken, healthy, third);
        givenModels(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true));
        when(runRepository.findByDefinitionsAndStatuses(anyList(), any())).thenReturn(List.of());
        when(runLaunchService.launch(any())).thenAnswer(inv -> {
            LaunchRequest request = inv.getArgument(0);
            if (request.definitionId().equals(broken.getId())) {
                throw new ValidationException("Definition has no scenarios");
            }
            return launched(request);
        });

        DomainTrialRunResult result = service.runTrialsForDomain(domain.getId(), null, null, USER);

        assertThat(result.success()).isFalse();
        assertThat(result.failedDefinitions()).isEqualTo(1);
        assertThat(result.startedRuns()).isEqualTo(2);
    }

    @Test
    void shouldReturnEmptySummaryForDomainWithoutDefinitions() {
        when(domainRepository.findById(domain.getId())).thenReturn(Optional.of(domain));
        when(definitionRepository.findByDomainIdAndDeletedAtIsNull(domain.getId())).thenReturn(List.of());

        DomainTrialRunResult result = service.runTrialsForDomain(domain.getId(), null, null, USER);

        assertThat(result.success()).isTrue();
        assertThat(result.targetedDefinitions()).isZero();
        verifyNoInteractions(runLaunchService, auditSink);
    }

    @Test
    void shouldRequireAuthenticatedUser() {
        assertThatThrownBy(() -> service.runTrialsForDomain(domain.getId(), null, null, " "))
            .isInstanceOf(AuthenticationRequiredException.class);
        verifyNoInteractions(domainRepository);
    }

    @Test
    void shouldReportMissingDomain() {
        when(domainRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.runTrialsForDomain("missing", null, null, USER))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldRetrySingleCell() {
        DefinitionEntity definition = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        when(domainRepository.findById(domain.getId())).thenReturn(Optional.of(domain));
        when(definitionRepository.findByIdAndDomainIdAndDeletedAtIsNull(definition.getId(), domain.getId()))
            .thenReturn(Optional.of(definition));
        when(modelRepository.findByModelIdAndStatus("gpt-4o", ModelStatus.ACTIVE))
            .thenReturn(Optional.of(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true)));
        when(runRepository.findByDefinitionsAndStatuses(eq(List.of(definition.getId())), any()))
            .thenReturn(List.of(activeRun(definition.getId(), List.of("gpt-4o", "claude-3"), null)));
        when(runLaunchService.launch(any())).thenAnswer(inv -> launched(inv.getArgument(0)));

        RetryDomainTrialCellResult result =
            service.retryDomainTrialCell(domain.getId(), definition.getId(), "gpt-4o", null, USER);

        assertThat(result.success()).isTrue();
        assertThat(result.runId()).isNotBlank();
        verify(auditSink).record(eq(DomainTrialService.RETRY_CELL_ACTION), eq(USER), eq(domain.getId()), eq("Domain"), anyMap());
    }

    @Test
    void shouldBlockRetryWhenCellIsAlreadyRunning() {
        DefinitionEntity definition = DefinitionEntity.create("a", null, domain.getId(), 1, null);
        when(domainRepository.findById(domain.getId())).thenReturn(Optional.of(domain));
        when(definitionRepository.findByIdAndDomainIdAndDeletedAtIsNull(definition.getId(), domain.getId()))
            .thenReturn(Optional.of(definition));
        when(modelRepository.findByModelIdAndStatus("gpt-4o", ModelStatus.ACTIVE))
            .thenReturn(Optional.of(LlmModelEntity.of("p1", "gpt-4o", ModelStatus.ACTIVE, true)));
        when(runRepository.findByDefinitionsAndStatuses(eq(List.of(definition.getId())), any()))
            .thenReturn(List.of(activeRun(definition.getId(), List.of("GPT-4O"), 1.0)));

        assertThatThrownBy(() -> service.retryDomainTrialCell(domain.getId(), definition.getId(), "gpt-4o", 1.0, USER))
            .isInstanceOf(ConflictException.class);
        verify(runLaunchService, never()).launch(any());
    }

    @Test
    void shouldRejectRetryForDefinitionOutsideDomain() {
        when(domainRepository.findById(domain.getId())).thenReturn(Optional.of(domain));
        when(definitionRepository.findByIdAndDomainIdAndDeletedAtIsNull("elsewhere", domain.getId()))
            .thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.retryDomainTrialCell(domain.getId(), "elsewhere", "gpt-4o", null, USER))
            .isInstanceOf(ValidationException.class);
    }

    private void givenDomain(DefinitionEntity... definitions) {
        when(domainRepository.findById(domain.getId())).thenReturn(Optional.of(domain));
        when(definitionRepository.findByDomainIdAndDeletedAtIsNull(domain.getId())).thenReturn(List.of(definitions));
    }

    private void givenModels(LlmModelEntity... models) {
        when(modelRepository.findByStatus(ModelStatus.ACTIVE)).thenReturn(List.of(models));
    }

    private void givenEstimate(DefinitionEntity definition, double total) {
        when(costEstimator.estimate(eq(definition.getId()), anyList(), eq(100), eq(1)))
            .thenReturn(new CostEstimate(total, List.of()));
    }

    private static LaunchResult launched(LaunchRequest request) {
        RunEntity run = RunEntity.launch("Mar 07-A", request.definitionId(), null, config(request.models(), request.temperature()),
            request.models().size(), request.userId());
        return new LaunchResult(run, request.models().size(), null);
    }

    private static RunEntity activeRun(String definitionId, List<String> models, Double temperature) {
        return RunEntity.launch("Mar 06-A", definitionId, null, config(models, temperature), 1, USER);
    }

    private static RunConfig config(List<String> models, Double temperature) {
        return new RunConfig(models, 100, null, temperature, "NORMAL", false, RunConfig.MODE_PERCENTAGE,
            List.of(), null, null, null, null, null);
    }
}

package com.valuerank.orchestration.service.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.valuerank.orchestration.domain.AnalysisResultEntity;
import com.valuerank.orchestration.domain.AnalysisStatus;
import com.valuerank.orchestration.domain.AnalysisType;
import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.error.ValidationException;
import com.valuerank.orchestration.repository.AnalysisResultRepository;
import com.valuerank.orchestration.repository.RunRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AnalysisResultService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisResultService.class);

    public static final String DEFAULT_CODE_VERSION = "1.0.0";

    private final AnalysisResultRepository analysisResultRepository;
    private final RunRepository runRepository;
    private final ApplicationEventPublisher eventPublisher;

    public AnalysisResultService(
        AnalysisResultRepository analysisResultRepository,
        RunRepository runRepository,
        ApplicationEventPublisher eventPublisher
    ) {
        this.analysisResultRepository = analysisResultRepository;
        this.runRepository = runRepository;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public AnalysisResultEntity recordRunAnalysis(String runId, JsonNode output, String codeVersion) {
        RunEntity run = runRepository.findById(runId)
            .filter(r -> !r.isDeleted())
            .orElseThrow(() -> new NotFoundException("Run", runId));
        if (run.isAggregate()) {
            throw new ValidationException("Aggregate run " + runId + " only receives results from aggregation");
        }

        AnalysisResultEntity saved = publishCurrent(
            runId,
            AnalysisType.BASIC,
            codeVersion == null || codeVersion.isBlank() ? DEFAULT_CODE_VERSION : codeVersion,
            InputHashes.sha256(output.toString()),
            output);

        RunConfig config = run.getConfig();
        eventPublisher.publishEvent(new RunAnalysisRecordedEvent(
            runId,
            run.getDefinitionId(),
            config == null ? null : config.preambleVersionId(),
            config == null ? null : config.definitionVersion()));
        LOGGER.info("Recorded basic analysis {} for run {}", saved.getId(), runId);
        return saved;
    }

    @Transactional
    public AnalysisResultEntity publishCurrent(
        String runId,
        AnalysisType type,
        String codeVersion,
        String inputHash,
        JsonNode output
    ) {
        int superseded = analysisResultRepository.supersedeCurrent(runId, type);
        if (superseded > 0) {
            LOGGER.debug("Superseded {} {} result(s) for run {}", superseded, type, runId);
        }
        return analysisResultRepository.save(AnalysisResultEntity.current(runId, type, codeVersion, inputHash, output));
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisResultEntity> currentFor(String runId, AnalysisType type) {
        return analysisResultRepository.findFirstByRunIdAndAnalysisTypeAndStatusOrderByCreatedAtDesc(
            runId, type, AnalysisStatus.CURRENT);
    }
}

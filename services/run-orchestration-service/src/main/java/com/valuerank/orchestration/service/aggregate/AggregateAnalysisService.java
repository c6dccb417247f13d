package com.valuerank.orchestration.service.aggregate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuerank.orchestration.domain.AnalysisResultEntity;
import com.valuerank.orchestration.domain.AnalysisType;
import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.repository.AnalysisResultRepository;
import com.valuerank.orchestration.repository.RunRepository;
import com.valuerank.orchestration.repository.TranscriptRepository;
import com.valuerank.orchestration.service.analysis.AnalysisResultService;
import com.valuerank.orchestration.service.analysis.InputHashes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AggregateAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateAnalysisService.class);

    static final String CODE_VERSION = "1.0.0";

    private final AdvisoryLock advisoryLock;
    private final RunRepository runRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final TranscriptRepository transcriptRepository;
    private final AnalysisResultService analysisResultService;
    private final AggregateStatisticsMerger merger;
    private final ObjectMapper objectMapper;

    public AggregateAnalysisService(
        AdvisoryLock advisoryLock,
        RunRepository runRepository,
        AnalysisResultRepository analysisResultRepository,
        TranscriptRepository transcriptRepository,
        AnalysisResultService analysisResultService,
        AggregateStatisticsMerger merger,
        ObjectMapper objectMapper
    ) {
        this.advisoryLock = advisoryLock;
        this.runRepository = runRepository;
        this.analysisResultRepository = analysisResultRepository;
        this.transcriptRepository = transcriptRepository;
        this.analysisResultService = analysisResultService;
        this.merger = merger;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public Optional<AggregateUpdate> updateAggregate(String definitionId, String preambleVersionId, Integer definitionVersion) {
        if (definitionId == null || definitionId.isBlank()) {
            throw new IllegalArgumentException("definitionId is required");
        }
        if (definitionVersion == null) {
            throw new IllegalArgumentException("definitionVersion is required; use the coordinator to aggregate every version");
        }
        LOGGER.info("Updating aggregate run for definition {} (preamble={}, version={})",
            definitionId, preambleVersionId, definitionVersion);
        advisoryLock.acquire(definitionId);

        List<RunEntity> compatible = runRepository.findCompletedSourceRuns(definitionId, Pageable.unpaged()).stream()
            .filter(run -> run.getConfig() != null && run.getConfig().matchesSnapshot(preambleVersionId, definitionVersion))
            .toList();
        if (compatible.isEmpty()) {
            LOGGER.info("No compatible runs found for aggregation of definition {}", definitionId);
            return Optional.empty();
        }
        List<String> sourceRunIds = compatible.stream().map(RunEntity::getId).toList();

        List<AnalysisResultEntity> currentResults = latestPerRun(
            analysisResultRepository.findCurrent(sourceRunIds, AnalysisType.BASIC));
        List<RunAnalysisOutput> analyses = new ArrayList<>();
        for (AnalysisResultEntity result : currentResults) {
            try {
                analyses.add(objectMapper.treeToValue(result.getOutput(), RunAnalysisOutput.class));
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                LOGGER.warn("Skipping unreadable analysis {} of run {}: {}", result.getId(), result.getRunId(), ex.getMessage());
            }
        }
        if (analyses.isEmpty()) {
            LOGGER.info("No valid analysis results found for compatible runs of definition {}", definitionId);
            return Optional.empty();
        }

        AggregateOutput output = merger.merge(analyses, transcriptRepository.findDecided(sourceRunIds), sourceRunIds);
        int transcriptCount = Math.toIntExact(transcriptRepository.countByRunIdIn(sourceRunIds));

        Optional<RunEntity> existing = runRepository.findAggregateRuns(definitionId).stream()
            .filter(run -> run.getConfig() != null && run.getConfig().matchesSnapshot(preambleVersionId, definitionVersion))
            .findFirst();
        RunEntity aggregateRun;
        if (existing.isPresent()) {
            aggregateRun = existing.get();
            aggregateRun.refreshAggregate(aggregateRun.getConfig().asAggregate(sourceRunIds, transcriptCount));
            LOGGER.info("Updating existing aggregate run {}", aggregateRun.getId());
        } else {
            RunEntity template = compatible.get(0);
            RunConfig config = template.getConfig().asAggregate(sourceRunIds, transcriptCount);
            aggregateRun = runRepository.save(RunEntity.aggregateOf(definitionId, config, template.getCreatedByUserId()));
            LOGGER.info("Created aggregate run {} for definition {}", aggregateRun.getId(), definitionId);
        }

        JsonNode outputJson = objectMapper.valueToTree(output);
        String inputHash = InputHashes.sha256("aggregate:" + currentResults.stream()
            .map(AnalysisResultEntity::getId)
            .sorted()
            .toList());
        analysisResultService.publishCurrent(aggregateRun.getId(), AnalysisType.AGGREGATE, CODE_VERSION, inputHash, outputJson);

        return Optional.of(new AggregateUpdate(
            aggregateRun.getId(),
            existing.isEmpty(),
            sourceRunIds,
            output.runCount(),
            transcriptCount));
    }

    private static List<AnalysisResultEntity> latestPerRun(List<AnalysisResultEntity> newestFirst) {
        Map<String, AnalysisResultEntity> byRun = new LinkedHashMap<>();
        for (AnalysisResultEntity result : newestFirst) {
            byRun.putIfAbsent(result.getRunId(), result);
        }
        return new ArrayList<>(byRun.values());
    }
}

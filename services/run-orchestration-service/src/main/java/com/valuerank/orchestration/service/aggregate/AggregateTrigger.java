package com.valuerank.orchestration.service.aggregate;

import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.service.analysis.RunAnalysisRecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts aggregation after a run's basic analysis has been committed. A failed lock or update is
 * not retried here; the next recorded analysis for the definition triggers it again.
 */
@Component
public class AggregateTrigger {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateTrigger.class);

    private final AggregateAnalysisCoordinator coordinator;
    private final OrchestratorProperties properties;

    public AggregateTrigger(AggregateAnalysisCoordinator coordinator, OrchestratorProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Async("orchestrationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRunAnalysisRecorded(RunAnalysisRecordedEvent event) {
        if (!properties.isAggregateAutoTrigger()) {
            LOGGER.debug("Aggregate auto-trigger disabled, ignoring analysis of run {}", event.runId());
            return;
        }
        try {
            coordinator.aggregate(event.definitionId(), event.preambleVersionId(), event.definitionVersion());
        } catch (RuntimeException ex) {
            LOGGER.error("Aggregate analysis failed for definition {} after run {}",
                event.definitionId(), event.runId(), ex);
        }
    }
}

package com.valuerank.orchestration.service.progress;

import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.domain.RunProgress;
import com.valuerank.orchestration.domain.RunStatus;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.repository.RunRepository;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RunProgressService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunProgressService.class);

    private final RunRepository runRepository;
    private final Clock clock;

    public RunProgressService(RunRepository runRepository, Clock clock) {
        this.runRepository = runRepository;
        this.clock = clock;
    }

    @Transactional
    public RunEntity recordCompleted(String runId) {
        if (runRepository.incrementCompleted(runId) == 0) {
            LOGGER.warn("Completed count not incremented for run {}: missing or already full", runId);
        }
        return applyTransition(runId);
    }

    @Transactional
    public RunEntity recordFailed(String runId) {
        if (runRepository.incrementFailed(runId) == 0) {
            LOGGER.warn("Failed count not incremented for run {}: missing or already full", runId);
        }
        return applyTransition(runId);
    }

    private RunEntity applyTransition(String runId) {
        RunEntity run = runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("Run", runId));
        if (run.getStatus().isTerminal()) {
            return run;
        }
        RunProgress progress = run.getProgress();
        if (progress.isFinished()) {
            if (run.getStatus() == RunStatus.PENDING) {
                run.transitionTo(RunStatus.RUNNING, clock.instant());
            }
            run.transitionTo(RunStatus.COMPLETED, clock.instant());
            LOGGER.info("Run {} completed: {} succeeded, {} failed of {}",
                runId, progress.getCompleted(), progress.getFailed(), progress.getTotal());
        } else if (run.getStatus() == RunStatus.PENDING && progress.done() > 0) {
            run.transitionTo(RunStatus.RUNNING, clock.instant());
        }
        return run;
    }
}

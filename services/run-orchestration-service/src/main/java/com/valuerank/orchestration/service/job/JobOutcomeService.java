package com.valuerank.orchestration.service.job;

import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.domain.ProbeJobEntity;
import com.valuerank.orchestration.error.NotFoundException;
import com.valuerank.orchestration.repository.ProbeJobRepository;
import com.valuerank.orchestration.service.progress.RunProgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JobOutcomeService {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobOutcomeService.class);

    static final String TERMINAL = "TERMINAL";
    static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
    private static final int MAX_MESSAGE_LENGTH = 400;

    private final ProbeJobRepository probeJobRepository;
    private final RunProgressService runProgressService;
    private final JobClassifier jobClassifier;
    private final OrchestratorProperties properties;

    public JobOutcomeService(
        ProbeJobRepository probeJobRepository,
        RunProgressService runProgressService,
        JobClassifier jobClassifier,
        OrchestratorProperties properties
    ) {
        this.probeJobRepository = probeJobRepository;
        this.runProgressService = runProgressService;
        this.jobClassifier = jobClassifier;
        this.properties = properties;
    }

    @Transactional
    public JobOutcome recordSuccess(String jobId) {
        ProbeJobEntity job = findJob(jobId);
        if (job.hasOutcome()) {
            LOGGER.info("Ignoring success for job {}: already {}", jobId, job.getStatus());
            return outcomeOf(job);
        }
        job.succeed();
        probeJobRepository.save(job);
        JobOutcome outcome = outcomeOf(job);
        runProgressService.recordCompleted(job.getRunId());
        return outcome;
    }

    @Transactional
    public JobOutcome recordFailure(String jobId, Object error) {
        ProbeJobEntity job = findJob(jobId);
        if (job.hasOutcome()) {
            LOGGER.info("Ignoring failure for job {}: already {}", jobId, job.getStatus());
            return outcomeOf(job);
        }
        String message = truncate(JobClassifier.render(error));
        boolean retryable = jobClassifier.isRetryable(error);
        if (retryable && job.getAttempts() + 1 < properties.getJobsMaxAttempts()) {
            job.requeue(message);
            probeJobRepository.save(job);
            LOGGER.info("Requeued job {} of run {} after attempt {}: {}",
                jobId, job.getRunId(), job.getAttempts(), message);
            return outcomeOf(job);
        }

        job.fail(retryable ? RETRIES_EXHAUSTED : TERMINAL, message);
        probeJobRepository.save(job);
        LOGGER.warn("Job {} of run {} failed ({}): {}", jobId, job.getRunId(), job.getErrorCode(), message);
        JobOutcome outcome = outcomeOf(job);
        runProgressService.recordFailed(job.getRunId());
        return outcome;
    }

    private ProbeJobEntity findJob(String jobId) {
        return probeJobRepository.findById(jobId)
            .orElseThrow(() -> new NotFoundException("ProbeJob", jobId));
    }

    private static JobOutcome outcomeOf(ProbeJobEntity job) {
        return new JobOutcome(job.getId(), job.getRunId(), job.getStatus(), job.getAttempts(), job.getErrorCode());
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}

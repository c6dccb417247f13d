package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.JobStatus;
import com.valuerank.orchestration.domain.ProbeJobEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProbeJobRepository extends JpaRepository<ProbeJobEntity, String> {

    List<ProbeJobEntity> findByRunId(String runId);

    long countByRunId(String runId);

    long countByRunIdAndStatus(String runId, JobStatus status);
}

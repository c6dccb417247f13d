package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.AnalysisResultEntity;
import com.valuerank.orchestration.domain.AnalysisStatus;
import com.valuerank.orchestration.domain.AnalysisType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnalysisResultRepository extends JpaRepository<AnalysisResultEntity, String> {

    @Query("""
        select a from AnalysisResultEntity a
        where a.runId in :runIds
          and a.analysisType = :type
          and a.status = com.valuerank.orchestration.domain.AnalysisStatus.CURRENT
        order by a.createdAt desc
        """)
    List<AnalysisResultEntity> findCurrent(
        @Param("runIds") Collection<String> runIds,
        @Param("type") AnalysisType type
    );

    Optional<AnalysisResultEntity> findFirstByRunIdAndAnalysisTypeAndStatusOrderByCreatedAtDesc(
        String runId,
        AnalysisType analysisType,
        AnalysisStatus status
    );

    List<AnalysisResultEntity> findByRunIdAndAnalysisTypeOrderByCreatedAtAsc(String runId, AnalysisType analysisType);

    @Modifying(flushAutomatically = true)
    @Query("""
        update AnalysisResultEntity a
        set a.status = com.valuerank.orchestration.domain.AnalysisStatus.SUPERSEDED
        where a.runId = :runId
          and a.analysisType = :type
          and a.status = com.valuerank.orchestration.domain.AnalysisStatus.CURRENT
        """)
    int supersedeCurrent(@Param("runId") String runId, @Param("type") AnalysisType type);
}

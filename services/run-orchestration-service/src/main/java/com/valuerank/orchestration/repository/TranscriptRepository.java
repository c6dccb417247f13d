package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.TranscriptEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TranscriptRepository extends JpaRepository<TranscriptEntity, String> {

    @Query("""
        select t from TranscriptEntity t, ScenarioEntity s
        where t.scenarioId = s.id
          and s.deletedAt is null
          and t.runId in :runIds
          and t.decisionCode is not null
        """)
    List<TranscriptEntity> findDecided(@Param("runIds") Collection<String> runIds);

    long countByRunIdIn(Collection<String> runIds);
}

package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.ScenarioEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScenarioRepository extends JpaRepository<ScenarioEntity, String> {

    @Query("""
        select s.id from ScenarioEntity s
        where s.definitionId = :definitionId
          and s.deletedAt is null
        order by s.id
        """)
    List<String> findEligibleIds(@Param("definitionId") String definitionId);
}

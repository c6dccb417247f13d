package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.LlmModelEntity;
import com.valuerank.orchestration.domain.ModelStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LlmModelRepository extends JpaRepository<LlmModelEntity, String> {

    List<LlmModelEntity> findByStatus(ModelStatus status);

    List<LlmModelEntity> findByModelIdInAndStatus(Collection<String> modelIds, ModelStatus status);

    Optional<LlmModelEntity> findByModelIdAndStatus(String modelId, ModelStatus status);

    @Query("""
        select m.modelId as modelId, p.name as providerName
        from LlmModelEntity m, LlmProviderEntity p
        where m.providerId = p.id
        """)
    List<ModelProviderRow> findModelProviders();

    @Query("""
        select p.name
        from LlmModelEntity m, LlmProviderEntity p
        where m.providerId = p.id
          and m.modelId = :modelId
        """)
    Optional<String> findProviderNameByModelId(@Param("modelId") String modelId);
}

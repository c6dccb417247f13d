package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.DefinitionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DefinitionRepository extends JpaRepository<DefinitionEntity, String> {

    List<DefinitionEntity> findByDomainIdAndDeletedAtIsNull(String domainId);

    Optional<DefinitionEntity> findByIdAndDeletedAtIsNull(String id);

    Optional<DefinitionEntity> findByIdAndDomainIdAndDeletedAtIsNull(String id, String domainId);
}

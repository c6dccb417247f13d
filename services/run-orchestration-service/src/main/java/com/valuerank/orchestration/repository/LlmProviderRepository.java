package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.LlmProviderEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LlmProviderRepository extends JpaRepository<LlmProviderEntity, String> {

    List<LlmProviderEntity> findByEnabledTrue();
}

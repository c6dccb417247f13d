package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.ExperimentEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExperimentRepository extends JpaRepository<ExperimentEntity, String> {
}

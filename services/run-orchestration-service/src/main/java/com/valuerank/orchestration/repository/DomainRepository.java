package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.DomainEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DomainRepository extends JpaRepository<DomainEntity, String> {
}

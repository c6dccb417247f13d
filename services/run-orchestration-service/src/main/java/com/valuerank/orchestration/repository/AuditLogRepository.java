package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.AuditLogEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

    List<AuditLogEntity> findByEntityIdOrderByCreatedAtDesc(String entityId);
}

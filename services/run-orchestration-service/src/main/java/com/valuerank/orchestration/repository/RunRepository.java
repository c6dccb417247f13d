package com.valuerank.orchestration.repository;

import com.valuerank.orchestration.domain.RunEntity;
import com.valuerank.orchestration.domain.RunStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RunRepository extends JpaRepository<RunEntity, String> {

    @Query("""
        select r from RunEntity r
        where r.definitionId in :definitionIds
          and r.status in :statuses
          and r.deletedAt is null
        """)
    List<RunEntity> findByDefinitionsAndStatuses(
        @Param("definitionIds") Collection<String> definitionIds,
        @Param("statuses") Collection<RunStatus> statuses
    );

    @Query("""
        select r from RunEntity r
        where r.definitionId = :definitionId
          and r.status = com.valuerank.orchestration.domain.RunStatus.COMPLETED
          and r.aggregate = false
          and r.deletedAt is null
        order by r.createdAt desc
        """)
    List<RunEntity> findCompletedSourceRuns(@Param("definitionId") String definitionId, Pageable pageable);

    @Query("""
        select r from RunEntity r
        where r.definitionId = :definitionId
          and r.aggregate = true
          and r.deletedAt is null
        order by r.createdAt asc
        """)
    List<RunEntity> findAggregateRuns(@Param("definitionId") String definitionId);

    @Query("""
        select count(r) from RunEntity r
        where r.definitionId = :definitionId
          and r.aggregate = false
          and r.deletedAt is null
          and r.createdAt >= :from
          and r.createdAt < :to
        """)
    long countCreatedBetween(
        @Param("definitionId") String definitionId,
        @Param("from") Instant from,
        @Param("to") Instant to
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update RunEntity r
        set r.progress.completed = r.progress.completed + 1
        where r.id = :runId
          and r.progress.completed + r.progress.failed < r.progress.total
        """)
    int incrementCompleted(@Param("runId") String runId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update RunEntity r
        set r.progress.failed = r.progress.failed + 1
        where r.id = :runId
          and r.progress.completed + r.progress.failed < r.progress.total
        """)
    int incrementFailed(@Param("runId") String runId);
}

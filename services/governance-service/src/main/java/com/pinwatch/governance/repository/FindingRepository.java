package com.pinwatch.governance.repository;

import com.pinwatch.governance.domain.FindingEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FindingRepository extends JpaRepository<FindingEntity, Long> {

    @Query("""
        select f from FindingEntity f, RunEntity r
        where r.id = f.runId
          and (:runId is null or f.runId = :runId)
          and (:repository is null or r.repository = :repository)
          and (:branch is null or r.branch = :branch)
          and (:workflowPath is null or f.workflowPath = :workflowPath)
          and (:actionId is null or f.actionId = :actionId)
        order by f.id desc
        """)
    List<FindingEntity> search(
        @Param("runId") Long runId,
        @Param("repository") String repository,
        @Param("branch") String branch,
        @Param("workflowPath") String workflowPath,
        @Param("actionId") String actionId,
        Pageable pageable
    );

    @Query("""
        select count(f) from FindingEntity f, RunEntity r
        where r.id = f.runId
          and (:runId is null or f.runId = :runId)
          and (:repository is null or r.repository = :repository)
          and (:branch is null or r.branch = :branch)
          and (:workflowPath is null or f.workflowPath = :workflowPath)
          and (:actionId is null or f.actionId = :actionId)
        """)
    long countMatching(
        @Param("runId") Long runId,
        @Param("repository") String repository,
        @Param("branch") String branch,
        @Param("workflowPath") String workflowPath,
        @Param("actionId") String actionId
    );

    List<FindingEntity> findByRunIdOrderByIdAsc(Long runId);

    @Query("""
        select f.actionId,
               count(f),
               sum(case when f.pinned = true then 1 else 0 end),
               sum(case when f.pinned = false then 1 else 0 end)
        from FindingEntity f
        group by f.actionId
        order by count(f) desc, f.actionId asc
        """)
    List<Object[]> aggregateByAction(Pageable pageable);

    long countByPinned(boolean pinned);

    @Modifying
    @Query("delete from FindingEntity f where f.runId in :runIds")
    int deleteByRunIdIn(@Param("runIds") List<Long> runIds);
}

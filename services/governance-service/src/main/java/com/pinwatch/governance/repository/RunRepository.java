package com.pinwatch.governance.repository;

import com.pinwatch.governance.domain.RunEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RunRepository extends JpaRepository<RunEntity, Long> {

    boolean existsByDeliveryId(String deliveryId);

    @Query("""
        select r from RunEntity r
        where (:repository is null or r.repository = :repository)
          and (:branch is null or r.branch = :branch)
        order by r.id desc
        """)
    List<RunEntity> search(
        @Param("repository") String repository,
        @Param("branch") String branch,
        Pageable pageable
    );

    @Query("""
        select count(r) from RunEntity r
        where (:repository is null or r.repository = :repository)
          and (:branch is null or r.branch = :branch)
        """)
    long countMatching(@Param("repository") String repository, @Param("branch") String branch);

    @Query("select r.id from RunEntity r order by r.id desc")
    List<Long> findIdsNewestFirst(Pageable pageable);

    @Query("""
        select r.repository, count(r), coalesce(sum(r.findingsCount), 0) from RunEntity r
        group by r.repository
        order by count(r) desc, r.repository asc
        """)
    List<Object[]> aggregateByRepository(Pageable pageable);

    @Modifying
    @Query("delete from RunEntity r where r.id in :ids")
    int deleteByIdIn(@Param("ids") List<Long> ids);
}

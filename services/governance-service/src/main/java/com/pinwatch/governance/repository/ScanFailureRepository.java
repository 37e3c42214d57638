package com.pinwatch.governance.repository;

import com.pinwatch.governance.domain.ScanFailureEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScanFailureRepository extends JpaRepository<ScanFailureEntity, Long> {

    List<ScanFailureEntity> findByRunIdOrderByIdAsc(Long runId);

    @Modifying
    @Query("delete from ScanFailureEntity s where s.runId in :runIds")
    int deleteByRunIdIn(@Param("runIds") List<Long> runIds);
}

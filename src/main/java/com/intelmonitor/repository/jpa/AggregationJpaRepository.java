package com.intelmonitor.repository.jpa;

import com.intelmonitor.domain.enums.AggregationPeriod;
import com.intelmonitor.entity.AggregationEntity;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface AggregationJpaRepository extends JpaRepository<AggregationEntity, Long> {

    Optional<AggregationEntity> findByMonitorIdAndPeriodAndStartTime(
            String monitorId, AggregationPeriod period, LocalDateTime startTime);

    /** Removes rollups whose window ended before the cutoff (their source snapshots are gone). */
    @Modifying
    @Transactional
    @Query("DELETE FROM AggregationEntity a WHERE a.endTime <= :cutoff")
    int deleteEndingBefore(@Param("cutoff") LocalDateTime cutoff);
}

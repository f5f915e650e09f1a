package com.intelmonitor.repository.jpa;

import com.intelmonitor.entity.SnapshotEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the snapshots table. Range queries are start-inclusive and
 * end-exclusive, ordered oldest first; {@link #findWithin} includes both ends.
 */
@Repository
public interface SnapshotJpaRepository extends JpaRepository<SnapshotEntity, Long> {

    @Query("SELECT s FROM SnapshotEntity s WHERE s.monitorId = :monitorId "
            + "AND s.timestamp >= :start AND s.timestamp < :end ORDER BY s.timestamp ASC")
    List<SnapshotEntity> findRange(
            @Param("monitorId") String monitorId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            Pageable pageable);

    @Query("SELECT s FROM SnapshotEntity s WHERE s.monitorId = :monitorId "
            + "AND s.timestamp >= :start AND s.timestamp <= :end ORDER BY s.timestamp ASC")
    List<SnapshotEntity> findWithin(
            @Param("monitorId") String monitorId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            Pageable pageable);

    Optional<SnapshotEntity> findFirstByMonitorIdOrderByTimestampDesc(String monitorId);

    long countByMonitorIdAndTimestampBefore(String monitorId, LocalDateTime cutoff);

    long countByTimestampBefore(LocalDateTime cutoff);

    @Modifying
    @Transactional
    @Query("DELETE FROM SnapshotEntity s WHERE s.monitorId = :monitorId AND s.timestamp < :cutoff")
    int deleteByMonitorIdBefore(@Param("monitorId") String monitorId, @Param("cutoff") LocalDateTime cutoff);

    @Modifying
    @Transactional
    @Query("DELETE FROM SnapshotEntity s WHERE s.timestamp < :cutoff")
    int deleteAllBefore(@Param("cutoff") LocalDateTime cutoff);
}

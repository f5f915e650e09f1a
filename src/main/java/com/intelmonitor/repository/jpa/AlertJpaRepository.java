package com.intelmonitor.repository.jpa;

import com.intelmonitor.entity.AlertEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    List<AlertEntity> findByMonitorIdOrderByCreatedAtDesc(String monitorId, Pageable pageable);

    List<AlertEntity> findByMonitorIdAndReadFalseOrderByCreatedAtDesc(String monitorId, Pageable pageable);

    @Query("SELECT a FROM AlertEntity a WHERE a.monitorId IN :monitorIds AND a.createdAt >= :since "
            + "ORDER BY a.createdAt DESC")
    List<AlertEntity> findRecentForMonitors(
            @Param("monitorIds") Collection<String> monitorIds, @Param("since") LocalDateTime since);

    long countByMonitorIdInAndReadFalse(Collection<String> monitorIds);
}

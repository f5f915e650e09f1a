package com.intelmonitor.repository.jpa;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.entity.MonitorEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface MonitorJpaRepository extends JpaRepository<MonitorEntity, String> {

    List<MonitorEntity> findByUserId(String userId);

    List<MonitorEntity> findByUserIdAndStatus(String userId, MonitorStatus status);

    List<MonitorEntity> findByStatus(MonitorStatus status);

    long countByStatus(MonitorStatus status);

    boolean existsByUserIdAndCompanyIgnoreCaseAndStatus(String userId, String company, MonitorStatus status);

    boolean existsByUserIdAndCompanyIgnoreCaseAndStatusAndIdNot(
            String userId, String company, MonitorStatus status, String id);

    /** Monitors due for a check: ACTIVE with next_check at or before {@code now}. */
    @Query("SELECT m FROM MonitorEntity m WHERE m.status = :status AND m.nextCheck <= :now ORDER BY m.nextCheck ASC")
    List<MonitorEntity> findDue(@Param("status") MonitorStatus status, @Param("now") LocalDateTime now);
}

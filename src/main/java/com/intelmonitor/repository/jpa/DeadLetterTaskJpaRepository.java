package com.intelmonitor.repository.jpa;

import com.intelmonitor.domain.enums.DeadLetterStatus;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.entity.DeadLetterTaskEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the dead_letter_tasks table.
 * Written by the task queue when retries are exhausted, read for operator inspection and requeue.
 */
@Repository
public interface DeadLetterTaskJpaRepository extends JpaRepository<DeadLetterTaskEntity, Long> {

    List<DeadLetterTaskEntity> findByStatus(DeadLetterStatus status);

    List<DeadLetterTaskEntity> findByTaskTypeAndStatus(TaskType taskType, DeadLetterStatus status);
}

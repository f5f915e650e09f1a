package com.intelmonitor.entity;

import com.intelmonitor.domain.enums.DeadLetterStatus;
import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the dead_letter_tasks table.
 * Stores tasks that exhausted their retry budget, for operator inspection and requeue.
 * Status lifecycle: PENDING → RETRYING → RESOLVED | DISCARDED.
 */
@Entity
@Table(name = "dead_letter_tasks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeadLetterTaskEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", length = 36)
    private String taskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", length = 30)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private TaskLane lane;

    @Column(columnDefinition = "CLOB")
    private String payload;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "stack_trace", columnDefinition = "CLOB")
    private String stackTrace;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "max_retries")
    private int maxRetries;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private DeadLetterStatus status;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "last_retry_at")
    private LocalDateTime lastRetryAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}

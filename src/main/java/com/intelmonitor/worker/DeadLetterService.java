package com.intelmonitor.worker;

import com.intelmonitor.domain.enums.DeadLetterStatus;
import com.intelmonitor.entity.DeadLetterTaskEntity;
import com.intelmonitor.exception.BusinessException;
import com.intelmonitor.exception.ErrorCode;
import com.intelmonitor.exception.ResourceNotFoundException;
import com.intelmonitor.mapper.JsonHelper;
import com.intelmonitor.observability.MonitoringMetricsService;
import com.intelmonitor.repository.jpa.DeadLetterTaskJpaRepository;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists tasks that exhausted their retry budget, and lets operators requeue or discard them.
 *
 * <p>A requeued task carries its dead-letter id in the payload; when it later succeeds the
 * entry is marked RESOLVED, when it fails again a new entry is written.
 */
@Service
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final DeadLetterTaskJpaRepository deadLetterTaskJpaRepository;
    private final TaskQueue taskQueue;
    private final MonitoringMetricsService monitoringMetricsService;
    private final Clock clock;

    public DeadLetterService(
            DeadLetterTaskJpaRepository deadLetterTaskJpaRepository,
            TaskQueue taskQueue,
            MonitoringMetricsService monitoringMetricsService,
            Clock clock) {
        this.deadLetterTaskJpaRepository = deadLetterTaskJpaRepository;
        this.taskQueue = taskQueue;
        this.monitoringMetricsService = monitoringMetricsService;
        this.clock = clock;
    }

    public DeadLetterTaskEntity deadLetter(MonitoringTask task, Throwable error, int maxRetries) {
        DeadLetterTaskEntity entity = DeadLetterTaskEntity.builder()
                .taskId(task.getTaskId())
                .taskType(task.getTaskType())
                .lane(task.getLane())
                .payload(JsonHelper.toJson(task.getPayload()))
                .errorMessage(truncate(String.valueOf(error.getMessage())))
                .stackTrace(stackTrace(error))
                .retryCount(task.getAttempt())
                .maxRetries(maxRetries)
                .status(DeadLetterStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
        DeadLetterTaskEntity saved = deadLetterTaskJpaRepository.save(entity);
        monitoringMetricsService.recordDeadLetter();
        log.error(
                "Task {} ({} on {}) dead-lettered after {} attempts: {}",
                task.getTaskId(),
                task.getTaskType(),
                task.getMonitorId(),
                task.getAttempt(),
                error.getMessage());
        return saved;
    }

    public List<DeadLetterTaskEntity> list(DeadLetterStatus status) {
        return deadLetterTaskJpaRepository.findByStatus(status);
    }

    /** Puts a pending dead-lettered task back on its lane with a fresh retry budget. */
    public MonitoringTask requeue(Long id) {
        DeadLetterTaskEntity entity = find(id);
        if (entity.getStatus() != DeadLetterStatus.PENDING) {
            throw new BusinessException(
                    ErrorCode.INVALID_STATE_TRANSITION, "Dead letter " + id + " is " + entity.getStatus());
        }
        Map<String, String> payload = JsonHelper.fromJsonMap(entity.getPayload(), String.class);
        payload.put(MonitoringTask.DEAD_LETTER_ID, String.valueOf(id));

        entity.setStatus(DeadLetterStatus.RETRYING);
        entity.setLastRetryAt(LocalDateTime.now(clock));
        deadLetterTaskJpaRepository.save(entity);

        log.info("Requeueing dead letter {} ({})", id, entity.getTaskType());
        return taskQueue.enqueue(entity.getTaskType(), entity.getLane(), payload);
    }

    public void discard(Long id) {
        DeadLetterTaskEntity entity = find(id);
        entity.setStatus(DeadLetterStatus.DISCARDED);
        entity.setResolvedAt(LocalDateTime.now(clock));
        deadLetterTaskJpaRepository.save(entity);
        log.info("Discarded dead letter {} ({})", id, entity.getTaskType());
    }

    /** Called when a requeued task succeeds. */
    public void markResolved(Long id) {
        deadLetterTaskJpaRepository.findById(id).ifPresent(entity -> {
            entity.setStatus(DeadLetterStatus.RESOLVED);
            entity.setResolvedAt(LocalDateTime.now(clock));
            deadLetterTaskJpaRepository.save(entity);
        });
    }

    private DeadLetterTaskEntity find(Long id) {
        return deadLetterTaskJpaRepository
                .findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("DeadLetterTask", String.valueOf(id)));
    }

    private static String truncate(String message) {
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}

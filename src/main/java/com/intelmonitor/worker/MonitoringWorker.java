package com.intelmonitor.worker;

import com.intelmonitor.config.WorkerConfig;
import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.entity.MonitorEntity;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls for due monitors and feeds their checks into the task queue.
 *
 * <p>Due monitors are ACTIVE with {@code nextCheck <= now}. Checks are enqueued on the
 * NORMAL lane in batches of {@code batchSize}; each batch is awaited before the next
 * is enqueued so a slow analysis engine is not flooded. A monitor whose previous check
 * is still in flight (for example waiting on a retry) is skipped.
 */
@Component
public class MonitoringWorker {

    private static final Logger log = LoggerFactory.getLogger(MonitoringWorker.class);

    private final MonitorJpaRepository monitorJpaRepository;
    private final TaskQueue taskQueue;
    private final WorkerConfig workerConfig;
    private final Clock clock;

    public MonitoringWorker(
            MonitorJpaRepository monitorJpaRepository, TaskQueue taskQueue, WorkerConfig workerConfig, Clock clock) {
        this.monitorJpaRepository = monitorJpaRepository;
        this.taskQueue = taskQueue;
        this.workerConfig = workerConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${intelmonitor.worker.poll-interval-ms:60000}")
    public void pollDueMonitors() {
        if (!workerConfig.isEnabled()) {
            return;
        }
        try {
            processDueMonitors();
        } catch (RuntimeException e) {
            log.error("Monitoring worker poll failed", e);
        }
    }

    /**
     * One polling pass.
     *
     * @return number of checks that completed successfully
     */
    public int processDueMonitors() {
        List<MonitorEntity> due =
                monitorJpaRepository.findDue(MonitorStatus.ACTIVE, LocalDateTime.now(clock));
        if (due.isEmpty()) {
            log.debug("No monitors due for checking");
            return 0;
        }
        log.info("Found {} monitors due for checking", due.size());

        int batchSize = Math.max(1, workerConfig.getBatchSize());
        int succeeded = 0;
        for (int i = 0; i < due.size(); i += batchSize) {
            List<MonitorEntity> batch = due.subList(i, Math.min(i + batchSize, due.size()));
            succeeded += runBatch(batch);
        }
        return succeeded;
    }

    private int runBatch(List<MonitorEntity> batch) {
        List<MonitoringTask> tasks = new ArrayList<>();
        int skipped = 0;
        for (MonitorEntity monitor : batch) {
            MonitoringTask task = taskQueue.enqueueIfAbsent(
                    TaskType.MONITOR_CHECK, TaskLane.NORMAL, Map.of(MonitoringTask.MONITOR_ID, monitor.getId()));
            if (task != null) {
                tasks.add(task);
            } else {
                skipped++;
            }
        }

        int succeeded = 0;
        int failed = 0;
        for (MonitoringTask task : tasks) {
            try {
                task.getCompletion().get(workerConfig.getTaskTimeoutSeconds(), TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                failed++;
                log.warn("Check for monitor {} failed: {}", task.getMonitorId(), e.getCause().getMessage());
            } catch (TimeoutException e) {
                failed++;
                log.warn("Check for monitor {} still pending after {}s", task.getMonitorId(),
                        workerConfig.getTaskTimeoutSeconds());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for batch completion");
                break;
            }
        }

        log.info("Batch complete: {} succeeded, {} failed, {} already in flight", succeeded, failed, skipped);
        return succeeded;
    }
}

package com.intelmonitor.worker;

import com.intelmonitor.config.WorkerConfig;
import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron entry points for housekeeping. Each job only enqueues a LOW-lane task; the work
 * itself runs on the queue consumers behind user-facing checks and alert delivery.
 *
 * <ul>
 *   <li>02:00 daily: aggregate yesterday's snapshots</li>
 *   <li>03:00 daily: retention cleanup</li>
 *   <li>04:00 Sunday: retrain forecast models</li>
 * </ul>
 */
@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final TaskQueue taskQueue;
    private final WorkerConfig workerConfig;

    public MaintenanceScheduler(TaskQueue taskQueue, WorkerConfig workerConfig) {
        this.taskQueue = taskQueue;
        this.workerConfig = workerConfig;
    }

    @Scheduled(cron = "${intelmonitor.worker.aggregation-cron:0 0 2 * * *}")
    public void scheduleDailyAggregation() {
        submit(TaskType.AGGREGATION);
    }

    @Scheduled(cron = "${intelmonitor.worker.retention-cron:0 0 3 * * *}")
    public void scheduleRetentionCleanup() {
        submit(TaskType.RETENTION_CLEANUP);
    }

    @Scheduled(cron = "${intelmonitor.worker.model-training-cron:0 0 4 * * SUN}")
    public void scheduleModelTraining() {
        submit(TaskType.MODEL_TRAINING);
    }

    public MonitoringTask submit(TaskType taskType) {
        if (!workerConfig.isEnabled()) {
            log.debug("Worker disabled, not scheduling {}", taskType);
            return null;
        }
        MonitoringTask task = taskQueue.enqueue(taskType, TaskLane.LOW, Map.of());
        log.info("Scheduled maintenance task {} ({})", task.getTaskId(), taskType);
        return task;
    }
}

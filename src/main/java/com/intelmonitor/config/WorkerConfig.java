package com.intelmonitor.config;

import com.intelmonitor.domain.enums.TaskType;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the scheduler and the task queue workers.
 */
@Configuration
@ConfigurationProperties(prefix = "intelmonitor.worker")
@Getter
@Setter
public class WorkerConfig {

    /** Whether the due-monitor polling loop and maintenance crons run. */
    private boolean enabled = true;

    /** Delay between due-monitor polls, in milliseconds. */
    private long pollIntervalMs = 60_000;

    /** Number of checks run concurrently per batch. */
    private int batchSize = 5;

    /** Number of consumer threads draining the task queue. */
    private int workerThreads = 5;

    /** Per-task timeout, in seconds. A timeout counts as a failed attempt. */
    private long taskTimeoutSeconds = 300;

    /** Attempts before a task is dead-lettered. */
    private int maxRetries = 3;

    /** Base of the exponential backoff, in seconds. */
    private long baseBackoffSeconds = 60;

    /** Backoff ceiling, in seconds (15 minutes). */
    private long maxBackoffSeconds = 900;

    /** Per-minute rate limits by task type. */
    private Map<TaskType, Integer> rateLimitsPerMinute = defaultRateLimits();

    private static Map<TaskType, Integer> defaultRateLimits() {
        Map<TaskType, Integer> limits = new EnumMap<>(TaskType.class);
        limits.put(TaskType.MONITOR_CHECK, 10);
        limits.put(TaskType.ALERT_DELIVERY, 30);
        limits.put(TaskType.AGGREGATION, 5);
        limits.put(TaskType.RETENTION_CLEANUP, 5);
        limits.put(TaskType.MODEL_TRAINING, 5);
        return limits;
    }
}

package com.intelmonitor.domain.enums;

/**
 * Work item kinds routed through the task queue. Each type has its own
 * per-minute rate limit.
 */
public enum TaskType {
    MONITOR_CHECK,
    ALERT_DELIVERY,
    AGGREGATION,
    RETENTION_CLEANUP,
    MODEL_TRAINING
}

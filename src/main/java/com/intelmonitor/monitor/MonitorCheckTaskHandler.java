package com.intelmonitor.monitor;

import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.exception.BusinessException;
import com.intelmonitor.exception.ErrorCode;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.RetryPolicy;
import com.intelmonitor.worker.TaskHandler;
import org.springframework.stereotype.Component;

/**
 * Runs a check cycle for the task's monitor. A failure only counts against the monitor once
 * the queue will not retry it, so one scheduled check is one failure however many attempts it took.
 */
@Component
public class MonitorCheckTaskHandler implements TaskHandler {

    private final IntelligenceMonitor intelligenceMonitor;
    private final RetryPolicy retryPolicy;

    public MonitorCheckTaskHandler(IntelligenceMonitor intelligenceMonitor, RetryPolicy retryPolicy) {
        this.intelligenceMonitor = intelligenceMonitor;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.MONITOR_CHECK;
    }

    @Override
    public void handle(MonitoringTask task) {
        String monitorId = task.getMonitorId();
        if (monitorId == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Check task " + task.getTaskId() + " has no monitorId");
        }
        int thisAttempt = task.getAttempt() + 1;
        intelligenceMonitor.checkForUpdates(monitorId, error -> !retryPolicy.shouldRetry(thisAttempt, error));
    }
}

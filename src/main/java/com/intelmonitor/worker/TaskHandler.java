package com.intelmonitor.worker;

import com.intelmonitor.domain.enums.TaskType;

/**
 * Executes one kind of task. Exactly one handler is registered per {@link TaskType}.
 */
public interface TaskHandler {

    TaskType getTaskType();

    void handle(MonitoringTask task) throws Exception;
}

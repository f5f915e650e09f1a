package com.intelmonitor.exception;

public class TaskTimeoutException extends BaseException {

    public TaskTimeoutException(String taskId, long timeoutSeconds) {
        super(ErrorCode.TASK_TIMEOUT, String.format("Task %s timed out after %ds", taskId, timeoutSeconds));
    }
}

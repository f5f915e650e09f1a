package com.intelmonitor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy for the monitoring engine.
 *
 * <p>Validation and state errors are rejected synchronously and never retried.
 * Upstream analysis and storage failures are transient and go through the task
 * queue's retry budget before landing in the dead-letter lane.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    DUPLICATE_MONITOR("DUPLICATE_MONITOR", 409, false),
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", 409, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    ANALYSIS_FAILED("ANALYSIS_FAILED", 502, true),
    STORAGE_ERROR("STORAGE_ERROR", 503, true),
    TASK_TIMEOUT("TASK_TIMEOUT", 504, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}

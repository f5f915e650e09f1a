package com.intelmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Static priority lanes of the task queue (lower level = dequeued first).
 *
 * <ul>
 *   <li>CRITICAL (0): user-triggered checks</li>
 *   <li>HIGH (1): alert delivery</li>
 *   <li>NORMAL (2): scheduled checks</li>
 *   <li>LOW (3): aggregation, retention cleanup, model retraining</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum TaskLane {
    CRITICAL(0),
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int level;
}

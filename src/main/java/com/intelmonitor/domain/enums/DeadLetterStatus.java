package com.intelmonitor.domain.enums;

/**
 * Status lifecycle of a dead-lettered task: PENDING → RETRYING → RESOLVED | DISCARDED.
 */
public enum DeadLetterStatus {
    PENDING,
    RETRYING,
    RESOLVED,
    DISCARDED
}

package com.intelmonitor.domain.enums;

/**
 * Lifecycle status of a monitor.
 * Transitions: ACTIVE → PAUSED/ERROR/DELETED, PAUSED → ACTIVE/DELETED,
 * ERROR → ACTIVE (manual only)/DELETED. DELETED is terminal.
 */
public enum MonitorStatus {
    ACTIVE,
    PAUSED,
    ERROR,
    DELETED
}

package com.intelmonitor.domain.enums;

/**
 * Severity of an alert as judged by root cause analysis.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

package com.intelmonitor.event;

/**
 * Classifies the monitor lifecycle change that triggered a {@link MonitorEvent}.
 */
public enum MonitorEventType {

    /** Monitor persisted and baseline analysis attempted. */
    CREATED,

    /** Settings changed. */
    UPDATED,

    /** Check cycle completed, with or without an alert. */
    CHECKED,

    /** Status moved through the state machine (pause, resume, delete, error). */
    STATUS_CHANGED,

    /** Check cycle threw; error counters were updated before rethrowing. */
    CHECK_FAILED
}

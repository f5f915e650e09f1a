package com.intelmonitor.event;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.model.Monitor;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the orchestrator when a monitor is created, changed or checked.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>MonitoringMetricsService: check counters and latency</li>
 * </ul>
 */
public class MonitorEvent extends ApplicationEvent {

    private final Monitor monitor;
    private final MonitorEventType eventType;
    private final MonitorStatus previousStatus;
    private final long durationMillis;

    public MonitorEvent(
            Object source, Monitor monitor, MonitorEventType eventType, MonitorStatus previousStatus, long durationMillis) {
        super(source);
        this.monitor = monitor;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.durationMillis = durationMillis;
    }

    public MonitorEvent(Object source, Monitor monitor, MonitorEventType eventType) {
        this(source, monitor, eventType, null, 0L);
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public MonitorEventType getEventType() {
        return eventType;
    }

    /** Status before a STATUS_CHANGED event; null otherwise. */
    public MonitorStatus getPreviousStatus() {
        return previousStatus;
    }

    /** Wall time of the check cycle for CHECKED and CHECK_FAILED events. */
    public long getDurationMillis() {
        return durationMillis;
    }
}

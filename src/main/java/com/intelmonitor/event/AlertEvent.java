package com.intelmonitor.event;

import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an alert is created, handed to delivery, suppressed, read or rated.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>AlertDispatchListener: enqueues a HIGH-lane delivery task on DISPATCH_REQUESTED</li>
 *   <li>MonitoringMetricsService: created/suppressed counters</li>
 * </ul>
 */
public class AlertEvent extends ApplicationEvent {

    private final Alert alert;
    private final Monitor monitor;
    private final AlertEventType eventType;

    public AlertEvent(Object source, Alert alert, Monitor monitor, AlertEventType eventType) {
        super(source);
        this.alert = alert;
        this.monitor = monitor;
        this.eventType = eventType;
    }

    public Alert getAlert() {
        return alert;
    }

    /** The owning monitor; may be null for READ and FEEDBACK events. */
    public Monitor getMonitor() {
        return monitor;
    }

    public AlertEventType getEventType() {
        return eventType;
    }
}

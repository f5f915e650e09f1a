package com.intelmonitor.event;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for monitor and alert events.
 *
 * <p>All methods are non-blocking from the caller's view; delivery depends on the listener
 * annotations ({@code @EventListener} vs {@code @Async @EventListener}).
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Monitor ----

    public void publishMonitorCreated(Object source, Monitor monitor) {
        applicationEventPublisher.publishEvent(new MonitorEvent(source, monitor, MonitorEventType.CREATED));
    }

    public void publishMonitorUpdated(Object source, Monitor monitor) {
        applicationEventPublisher.publishEvent(new MonitorEvent(source, monitor, MonitorEventType.UPDATED));
    }

    public void publishStatusChanged(Object source, Monitor monitor, MonitorStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new MonitorEvent(source, monitor, MonitorEventType.STATUS_CHANGED, previousStatus, 0L));
    }

    public void publishMonitorChecked(Object source, Monitor monitor, long durationMillis) {
        applicationEventPublisher.publishEvent(
                new MonitorEvent(source, monitor, MonitorEventType.CHECKED, null, durationMillis));
    }

    public void publishCheckFailed(Object source, Monitor monitor, long durationMillis) {
        applicationEventPublisher.publishEvent(
                new MonitorEvent(source, monitor, MonitorEventType.CHECK_FAILED, null, durationMillis));
    }

    // ---- Alert ----

    public void publishAlertCreated(Object source, Alert alert, Monitor monitor) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, alert, monitor, AlertEventType.CREATED));
    }

    public void publishDispatchRequested(Object source, Alert alert, Monitor monitor) {
        applicationEventPublisher.publishEvent(
                new AlertEvent(source, alert, monitor, AlertEventType.DISPATCH_REQUESTED));
    }

    public void publishAlertSuppressed(Object source, Alert alert, Monitor monitor) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, alert, monitor, AlertEventType.SUPPRESSED));
    }

    public void publishAlertRead(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, alert, null, AlertEventType.READ));
    }

    public void publishAlertFeedback(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, alert, null, AlertEventType.FEEDBACK));
    }
}

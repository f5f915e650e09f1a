package com.intelmonitor.notification;

import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.event.AlertEvent;
import com.intelmonitor.event.AlertEventType;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskQueue;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Turns DISPATCH_REQUESTED alert events into HIGH-lane delivery tasks, so delivery gets
 * the task queue's rate limit and retries instead of running on the check thread.
 */
@Component
public class AlertDispatchListener {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatchListener.class);

    private final TaskQueue taskQueue;

    public AlertDispatchListener(TaskQueue taskQueue) {
        this.taskQueue = taskQueue;
    }

    @EventListener
    @Order(10)
    public void onAlertEvent(AlertEvent event) {
        if (event.getEventType() != AlertEventType.DISPATCH_REQUESTED) {
            return;
        }
        taskQueue.enqueue(
                TaskType.ALERT_DELIVERY,
                TaskLane.HIGH,
                Map.of(
                        MonitoringTask.MONITOR_ID, event.getAlert().getMonitorId(),
                        MonitoringTask.ALERT_ID, event.getAlert().getId()));
        log.debug("Delivery task enqueued for alert {}", event.getAlert().getId());
    }
}

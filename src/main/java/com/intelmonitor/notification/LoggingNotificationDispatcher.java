package com.intelmonitor.notification;

import com.intelmonitor.domain.enums.NotificationChannel;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default dispatcher: records the hand-off in the log. Replaced by declaring another
 * {@link NotificationDispatcher} bean.
 */
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public void dispatch(Alert alert, Monitor monitor, List<NotificationChannel> channels) {
        log.info(
                "Alert {} for {} ({}) ready for delivery via {}: {}",
                alert.getId(),
                monitor.getCompany(),
                alert.getPriority() != null ? alert.getPriority().getUrgencyLevel() : null,
                channels,
                alert.getTitle());
    }
}

package com.intelmonitor.notification;

import com.intelmonitor.domain.enums.NotificationChannel;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import java.util.List;

/**
 * Delivers an alert over the monitor's channels. Transports (email, chat, webhooks) live
 * outside the engine.
 */
public interface NotificationDispatcher {

    void dispatch(Alert alert, Monitor monitor, List<NotificationChannel> channels);
}

package com.intelmonitor.notification;

import com.intelmonitor.alert.AlertService;
import com.intelmonitor.domain.enums.NotificationChannel;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import com.intelmonitor.exception.ResourceNotFoundException;
import com.intelmonitor.mapper.MonitorMapper;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskHandler;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Component;

@Component
public class AlertDeliveryTaskHandler implements TaskHandler {

    private final AlertService alertService;
    private final MonitorJpaRepository monitorJpaRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final MonitorMapper monitorMapper = Mappers.getMapper(MonitorMapper.class);

    public AlertDeliveryTaskHandler(
            AlertService alertService,
            MonitorJpaRepository monitorJpaRepository,
            NotificationDispatcher notificationDispatcher) {
        this.alertService = alertService;
        this.monitorJpaRepository = monitorJpaRepository;
        this.notificationDispatcher = notificationDispatcher;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.ALERT_DELIVERY;
    }

    @Override
    public void handle(MonitoringTask task) {
        Alert alert = alertService.getAlert(task.getPayload().get(MonitoringTask.ALERT_ID));
        Monitor monitor = monitorJpaRepository
                .findById(alert.getMonitorId())
                .map(monitorMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Monitor", alert.getMonitorId()));
        List<NotificationChannel> channels = monitor.getSettings().getNotificationChannels();
        notificationDispatcher.dispatch(alert, monitor, channels != null ? channels : List.of());
    }
}

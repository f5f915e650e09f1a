package com.intelmonitor.unit.notification;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.intelmonitor.alert.AlertService;
import com.intelmonitor.domain.enums.NotificationChannel;
import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import com.intelmonitor.domain.model.MonitorSettings;
import com.intelmonitor.exception.ResourceNotFoundException;
import com.intelmonitor.mapper.MonitorMapper;
import com.intelmonitor.notification.AlertDeliveryTaskHandler;
import com.intelmonitor.notification.NotificationDispatcher;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.worker.MonitoringTask;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AlertDeliveryTaskHandlerTest {

    @Mock
    private AlertService alertService;

    @Mock
    private MonitorJpaRepository monitorJpaRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private AlertDeliveryTaskHandler handler;

    private final MonitorMapper monitorMapper = Mappers.getMapper(MonitorMapper.class);

    @BeforeEach
    void setUp() {
        handler = new AlertDeliveryTaskHandler(alertService, monitorJpaRepository, notificationDispatcher);
    }

    private static MonitoringTask deliveryTask(String alertId) {
        return MonitoringTask.builder()
                .taskId("t1")
                .taskType(TaskType.ALERT_DELIVERY)
                .lane(TaskLane.HIGH)
                .payload(new HashMap<>(Map.of(MonitoringTask.ALERT_ID, alertId, MonitoringTask.MONITOR_ID, "m1")))
                .build();
    }

    @Test
    @DisplayName("Delivers the stored alert over the monitor's configured channels")
    void deliversOverChannels() throws Exception {
        Alert alert = Alert.builder().id("a1").monitorId("m1").title("HIGH: Acme Corp").build();
        Monitor monitor = Monitor.builder()
                .id("m1")
                .company("Acme Corp")
                .settings(MonitorSettings.builder()
                        .notificationChannels(List.of(NotificationChannel.CHAT))
                        .build())
                .build();
        when(alertService.getAlert("a1")).thenReturn(alert);
        when(monitorJpaRepository.findById("m1")).thenReturn(Optional.of(monitorMapper.toEntity(monitor)));

        handler.handle(deliveryTask("a1"));

        verify(notificationDispatcher).dispatch(eq(alert), any(Monitor.class), eq(List.of(NotificationChannel.CHAT)));
    }

    @Test
    @DisplayName("Missing monitor fails the task without dispatching")
    void missingMonitor() {
        when(alertService.getAlert("a1")).thenReturn(Alert.builder().id("a1").monitorId("m1").build());
        when(monitorJpaRepository.findById("m1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> handler.handle(deliveryTask("a1"))).isInstanceOf(ResourceNotFoundException.class);
        verify(notificationDispatcher, never()).dispatch(any(), any(), any());
    }
}

package com.intelmonitor.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import com.intelmonitor.event.AlertEvent;
import com.intelmonitor.event.AlertEventType;
import com.intelmonitor.event.EventPublisherHelper;
import com.intelmonitor.event.MonitorEvent;
import com.intelmonitor.event.MonitorEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link EventPublisherHelper}.
 *
 * <p>Verifies that the typed publish methods build the right event with the expected
 * fields and hand it to Spring's ApplicationEventPublisher.
 */
@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper eventPublisherHelper;

    private final Monitor monitor =
            Monitor.builder().id("m1").company("Acme Corp").status(MonitorStatus.ACTIVE).build();
    private final Alert alert = Alert.builder().id("a1").monitorId("m1").build();

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
    }

    private MonitorEvent captureMonitorEvent() {
        ArgumentCaptor<MonitorEvent> captor = ArgumentCaptor.forClass(MonitorEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    private AlertEvent captureAlertEvent() {
        ArgumentCaptor<AlertEvent> captor = ArgumentCaptor.forClass(AlertEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("publishStatusChanged carries the previous status")
    void statusChanged() {
        eventPublisherHelper.publishStatusChanged(this, monitor, MonitorStatus.ERROR);

        MonitorEvent event = captureMonitorEvent();
        assertThat(event.getEventType()).isEqualTo(MonitorEventType.STATUS_CHANGED);
        assertThat(event.getPreviousStatus()).isEqualTo(MonitorStatus.ERROR);
        assertThat(event.getMonitor()).isSameAs(monitor);
        assertThat(event.getSource()).isSameAs(this);
    }

    @Test
    @DisplayName("publishMonitorChecked carries the cycle duration")
    void monitorChecked() {
        eventPublisherHelper.publishMonitorChecked(this, monitor, 1234L);

        MonitorEvent event = captureMonitorEvent();
        assertThat(event.getEventType()).isEqualTo(MonitorEventType.CHECKED);
        assertThat(event.getDurationMillis()).isEqualTo(1234L);
        assertThat(event.getPreviousStatus()).isNull();
    }

    @Test
    @DisplayName("publishCheckFailed is typed CHECK_FAILED")
    void checkFailed() {
        eventPublisherHelper.publishCheckFailed(this, monitor, 50L);

        assertThat(captureMonitorEvent().getEventType()).isEqualTo(MonitorEventType.CHECK_FAILED);
    }

    @Test
    @DisplayName("publishDispatchRequested carries alert and monitor")
    void dispatchRequested() {
        eventPublisherHelper.publishDispatchRequested(this, alert, monitor);

        AlertEvent event = captureAlertEvent();
        assertThat(event.getEventType()).isEqualTo(AlertEventType.DISPATCH_REQUESTED);
        assertThat(event.getAlert()).isSameAs(alert);
        assertThat(event.getMonitor()).isSameAs(monitor);
    }

    @Test
    @DisplayName("publishAlertRead has no monitor attached")
    void alertRead() {
        eventPublisherHelper.publishAlertRead(this, alert);

        AlertEvent event = captureAlertEvent();
        assertThat(event.getEventType()).isEqualTo(AlertEventType.READ);
        assertThat(event.getMonitor()).isNull();
    }
}

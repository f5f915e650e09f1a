package com.intelmonitor.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Monitor;
import com.intelmonitor.event.AlertEvent;
import com.intelmonitor.event.AlertEventType;
import com.intelmonitor.event.MonitorEvent;
import com.intelmonitor.event.MonitorEventType;
import com.intelmonitor.observability.MonitoringMetricsService;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.snapshot.SnapshotStore;
import com.intelmonitor.worker.TaskQueue;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for MonitoringMetricsService counters, timer and gauges.
 *
 * <p>Lenient strictness because gauges only call their suppliers when read.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MonitoringMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private MonitoringMetricsService metricsService;

    @Mock
    private MonitorJpaRepository monitorJpaRepository;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private SnapshotStore snapshotStore;

    private final Monitor monitor =
            Monitor.builder().id("m1").company("Acme Corp").status(MonitorStatus.ACTIVE).build();
    private final Alert alert = Alert.builder().id("a1").monitorId("m1").build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new MonitoringMetricsService(meterRegistry, monitorJpaRepository, taskQueue, snapshotStore);
    }

    @Nested
    @DisplayName("Check metrics")
    class CheckMetrics {

        @Test
        @DisplayName("CHECKED increments the check counter and records latency")
        void checkedEvent() {
            metricsService.onMonitorEvent(new MonitorEvent(this, monitor, MonitorEventType.CHECKED, null, 250L));

            assertThat(meterRegistry.get("monitor.checks.count").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("monitor.check.latency").timer().count()).isEqualTo(1L);
            assertThat(meterRegistry.get("monitor.check.latency").timer().totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(250.0);
        }

        @Test
        @DisplayName("CHECK_FAILED increments the failure counter only")
        void failedEvent() {
            metricsService.onMonitorEvent(new MonitorEvent(this, monitor, MonitorEventType.CHECK_FAILED, null, 40L));

            assertThat(meterRegistry.get("monitor.checks.failed").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("monitor.checks.count").counter().count()).isZero();
        }

        @Test
        @DisplayName("Lifecycle events do not touch check metrics")
        void lifecycleIgnored() {
            metricsService.onMonitorEvent(new MonitorEvent(this, monitor, MonitorEventType.CREATED));
            metricsService.onMonitorEvent(new MonitorEvent(this, monitor, MonitorEventType.STATUS_CHANGED));

            assertThat(meterRegistry.get("monitor.checks.count").counter().count()).isZero();
            assertThat(meterRegistry.get("monitor.check.latency").timer().count()).isZero();
        }
    }

    @Nested
    @DisplayName("Alert and task metrics")
    class AlertMetrics {

        @Test
        @DisplayName("CREATED and SUPPRESSED feed separate counters")
        void alertCounters() {
            metricsService.onAlertEvent(new AlertEvent(this, alert, monitor, AlertEventType.CREATED));
            metricsService.onAlertEvent(new AlertEvent(this, alert, monitor, AlertEventType.CREATED));
            metricsService.onAlertEvent(new AlertEvent(this, alert, monitor, AlertEventType.SUPPRESSED));
            metricsService.onAlertEvent(new AlertEvent(this, alert, monitor, AlertEventType.READ));

            assertThat(meterRegistry.get("alerts.created.count").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("alerts.suppressed.count").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("recordDeadLetter increments the dead-letter counter")
        void deadLetterCounter() {
            metricsService.recordDeadLetter();

            assertThat(meterRegistry.get("tasks.dead_lettered.count").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauges")
    class Gauges {

        @Test
        @DisplayName("Gauges read live values from their sources")
        void gaugesReflectSources() {
            when(monitorJpaRepository.countByStatus(MonitorStatus.ACTIVE)).thenReturn(7L);
            when(taskQueue.size()).thenReturn(3);
            when(snapshotStore.getPendingWriteCount()).thenReturn(12);

            assertThat(meterRegistry.get("monitors.active").gauge().value()).isEqualTo(7.0);
            assertThat(meterRegistry.get("tasks.queued").gauge().value()).isEqualTo(3.0);
            assertThat(meterRegistry.get("snapshots.pending_writes").gauge().value()).isEqualTo(12.0);
        }
    }
}

package com.intelmonitor.observability;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.event.AlertEvent;
import com.intelmonitor.event.AlertEventType;
import com.intelmonitor.event.MonitorEvent;
import com.intelmonitor.event.MonitorEventType;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.snapshot.SnapshotStore;
import com.intelmonitor.worker.TaskQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer metrics.
 *
 * <ul>
 *   <li><b>monitor.checks.count</b> (counter): completed check cycles</li>
 *   <li><b>monitor.checks.failed</b> (counter): check cycles that threw</li>
 *   <li><b>monitor.check.latency</b> (timer): check cycle wall time</li>
 *   <li><b>alerts.created.count</b> (counter): persisted alerts</li>
 *   <li><b>alerts.suppressed.count</b> (counter): alerts not delivered</li>
 *   <li><b>tasks.dead_lettered.count</b> (counter): tasks that exhausted their retries</li>
 *   <li><b>monitors.active</b>, <b>tasks.queued</b>, <b>snapshots.pending_writes</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer on scrape. Counters and the timer are
 * driven by event listeners at {@code @Order(20)}, after core listeners.
 */
@Service
public class MonitoringMetricsService {

    private final Counter checksCounter;
    private final Counter checksFailedCounter;
    private final Counter alertsCreatedCounter;
    private final Counter alertsSuppressedCounter;
    private final Counter deadLetteredCounter;
    private final Timer checkLatencyTimer;

    public MonitoringMetricsService(
            MeterRegistry meterRegistry,
            MonitorJpaRepository monitorJpaRepository,
            TaskQueue taskQueue,
            SnapshotStore snapshotStore) {
        this.checksCounter = Counter.builder("monitor.checks.count")
                .description("Completed monitor check cycles")
                .register(meterRegistry);

        this.checksFailedCounter = Counter.builder("monitor.checks.failed")
                .description("Monitor check cycles that failed")
                .register(meterRegistry);

        this.alertsCreatedCounter = Counter.builder("alerts.created.count")
                .description("Alerts persisted")
                .register(meterRegistry);

        this.alertsSuppressedCounter = Counter.builder("alerts.suppressed.count")
                .description("Alerts suppressed by dedup, daily cap or tier")
                .register(meterRegistry);

        this.deadLetteredCounter = Counter.builder("tasks.dead_lettered.count")
                .description("Tasks moved to the dead-letter table after exhausting retries")
                .register(meterRegistry);

        this.checkLatencyTimer = Timer.builder("monitor.check.latency")
                .description("Wall time of a monitor check cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMinutes(5))
                .register(meterRegistry);

        meterRegistry.gauge(
                "monitors.active", monitorJpaRepository, repo -> repo.countByStatus(MonitorStatus.ACTIVE));
        meterRegistry.gauge("tasks.queued", taskQueue, TaskQueue::size);
        meterRegistry.gauge("snapshots.pending_writes", snapshotStore, SnapshotStore::getPendingWriteCount);
    }

    @EventListener
    @Order(20)
    public void onMonitorEvent(MonitorEvent event) {
        if (event.getEventType() == MonitorEventType.CHECKED) {
            checksCounter.increment();
            checkLatencyTimer.record(event.getDurationMillis(), TimeUnit.MILLISECONDS);
        } else if (event.getEventType() == MonitorEventType.CHECK_FAILED) {
            checksFailedCounter.increment();
            checkLatencyTimer.record(event.getDurationMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @EventListener
    @Order(20)
    public void onAlertEvent(AlertEvent event) {
        if (event.getEventType() == AlertEventType.CREATED) {
            alertsCreatedCounter.increment();
        } else if (event.getEventType() == AlertEventType.SUPPRESSED) {
            alertsSuppressedCounter.increment();
        }
    }

    public void recordDeadLetter() {
        deadLetteredCounter.increment();
    }
}

package com.intelmonitor.monitor;

import com.intelmonitor.alert.AlertScorer;
import com.intelmonitor.alert.AlertService;
import com.intelmonitor.analysis.AnalysisEngine;
import com.intelmonitor.analysis.AnalysisRequest;
import com.intelmonitor.anomaly.AnomalyDetector;
import com.intelmonitor.anomaly.ModelTrainingService;
import com.intelmonitor.change.ChangeDetector;
import com.intelmonitor.config.AnomalyDetectionConfig;
import com.intelmonitor.domain.enums.ChangeType;
import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.AlertPriority;
import com.intelmonitor.domain.model.AnalysisResult;
import com.intelmonitor.domain.model.AnomalyScore;
import com.intelmonitor.domain.model.Change;
import com.intelmonitor.domain.model.Monitor;
import com.intelmonitor.domain.model.MonitorSettings;
import com.intelmonitor.domain.model.MonitoringStats;
import com.intelmonitor.domain.model.RootCauseExplanation;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.entity.AlertEntity;
import com.intelmonitor.entity.MonitorEntity;
import com.intelmonitor.event.EventPublisherHelper;
import com.intelmonitor.exception.BusinessException;
import com.intelmonitor.exception.ErrorCode;
import com.intelmonitor.exception.ResourceNotFoundException;
import com.intelmonitor.mapper.AlertMapper;
import com.intelmonitor.mapper.MonitorMapper;
import com.intelmonitor.repository.jpa.AlertJpaRepository;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.rootcause.RootCauseAnalyzer;
import com.intelmonitor.snapshot.SnapshotStore;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskQueue;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the monitor lifecycle and runs the check cycle.
 *
 * <p>A check cycle re-analyzes the company, stores the new snapshot, diffs it against
 * the previous one, runs anomaly detection over the history window, and turns
 * significant findings into a scored, root-caused alert. Alerts are always persisted;
 * only those passing dedup, daily cap and tier checks are dispatched.
 *
 * <p>A failed cycle increments the monitor's error count and rethrows so the task
 * queue can retry. Five consecutive failures move the monitor to ERROR, where it stays
 * until reactivated through {@link #updateMonitor}.
 */
@Service
public class IntelligenceMonitor {

    private static final Logger log = LoggerFactory.getLogger(IntelligenceMonitor.class);

    static final int MAX_CONSECUTIVE_ERRORS = 5;
    static final int RECENT_ALERT_LOOKBACK = 20;
    static final double DEFAULT_ALERT_CONFIDENCE = 0.5;
    static final int TOP_CHANGE_TYPES = 5;

    private final MonitorJpaRepository monitorJpaRepository;
    private final AlertJpaRepository alertJpaRepository;
    private final SnapshotStore snapshotStore;
    private final AnalysisEngine analysisEngine;
    private final ChangeDetector changeDetector;
    private final AnomalyDetector anomalyDetector;
    private final ModelTrainingService modelTrainingService;
    private final AlertScorer alertScorer;
    private final AlertService alertService;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final MonitorStateMachine monitorStateMachine;
    private final MonitorSettingsValidator monitorSettingsValidator;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskQueue taskQueue;
    private final AnomalyDetectionConfig anomalyDetectionConfig;
    private final Clock clock;

    private final MonitorMapper monitorMapper = Mappers.getMapper(MonitorMapper.class);
    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    public IntelligenceMonitor(
            MonitorJpaRepository monitorJpaRepository,
            AlertJpaRepository alertJpaRepository,
            SnapshotStore snapshotStore,
            AnalysisEngine analysisEngine,
            ChangeDetector changeDetector,
            AnomalyDetector anomalyDetector,
            ModelTrainingService modelTrainingService,
            AlertScorer alertScorer,
            AlertService alertService,
            RootCauseAnalyzer rootCauseAnalyzer,
            MonitorStateMachine monitorStateMachine,
            MonitorSettingsValidator monitorSettingsValidator,
            EventPublisherHelper eventPublisherHelper,
            TaskQueue taskQueue,
            AnomalyDetectionConfig anomalyDetectionConfig,
            Clock clock) {
        this.monitorJpaRepository = monitorJpaRepository;
        this.alertJpaRepository = alertJpaRepository;
        this.snapshotStore = snapshotStore;
        this.analysisEngine = analysisEngine;
        this.changeDetector = changeDetector;
        this.anomalyDetector = anomalyDetector;
        this.modelTrainingService = modelTrainingService;
        this.alertScorer = alertScorer;
        this.alertService = alertService;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.monitorStateMachine = monitorStateMachine;
        this.monitorSettingsValidator = monitorSettingsValidator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.taskQueue = taskQueue;
        this.anomalyDetectionConfig = anomalyDetectionConfig;
        this.clock = clock;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Creates an ACTIVE monitor and captures its baseline snapshot.
     *
     * <p>A failing baseline analysis does not reject the monitor: it is saved with
     * {@code errorCount = 1} and the first scheduled check retries the analysis.
     *
     * @throws BusinessException VALIDATION_ERROR for blank ids or bad settings,
     *     DUPLICATE_MONITOR when the owner already has an active monitor for the company
     */
    public Monitor createMonitor(String userId, String company, String industry, MonitorSettings settings) {
        String owner = userId != null ? userId.trim() : "";
        String name = company != null ? company.trim() : "";
        if (owner.isEmpty() || name.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "userId and company are required");
        }
        MonitorSettings validated = monitorSettingsValidator.validate(settings);

        if (monitorJpaRepository.existsByUserIdAndCompanyIgnoreCaseAndStatus(owner, name, MonitorStatus.ACTIVE)) {
            throw new BusinessException(
                    ErrorCode.DUPLICATE_MONITOR,
                    "Active monitor already exists for " + name,
                    Map.of("userId", owner, "company", name));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Monitor monitor = Monitor.builder()
                .id(UUID.randomUUID().toString())
                .userId(owner)
                .company(name)
                .industry(industry != null ? industry.trim() : null)
                .settings(validated)
                .status(MonitorStatus.ACTIVE)
                .createdAt(now)
                .nextCheck(now.plus(validated.getFrequency().getInterval()))
                .build();

        try {
            AnalysisResult baseline = analysisEngine.analyze(toRequest(monitor));
            snapshotStore.put(buildSnapshot(monitor, baseline, now));
            log.info("Baseline snapshot captured for monitor {} ({})", monitor.getId(), name);
        } catch (RuntimeException e) {
            log.error("Baseline analysis failed for monitor {} ({})", monitor.getId(), name, e);
            monitor.setErrorCount(1);
            monitor.setLastError("Baseline analysis failed: " + e.getMessage());
        }

        Monitor saved = save(monitor);
        eventPublisherHelper.publishMonitorCreated(this, saved);
        log.info("Created monitor {} for {} (user {}, frequency {})",
                saved.getId(), name, owner, validated.getFrequency());
        return saved;
    }

    public Monitor getMonitor(String monitorId) {
        return monitorJpaRepository
                .findById(monitorId)
                .map(monitorMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Monitor", monitorId));
    }

    /** All of the owner's monitors, or only those in {@code status} when given. */
    public List<Monitor> listMonitors(String userId, MonitorStatus status) {
        List<MonitorEntity> entities = status != null
                ? monitorJpaRepository.findByUserIdAndStatus(userId, status)
                : monitorJpaRepository.findByUserId(userId);
        return monitorMapper.toDomainList(entities);
    }

    /**
     * Replaces settings and/or moves the monitor to a new status. New settings reschedule
     * the next check from now. ERROR to ACTIVE clears the error counters.
     */
    public Monitor updateMonitor(String monitorId, MonitorSettings settings, MonitorStatus status) {
        Monitor monitor = getMonitor(monitorId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (settings != null) {
            MonitorSettings validated = monitorSettingsValidator.validate(settings);
            monitor.setSettings(validated);
            monitor.setNextCheck(now.plus(validated.getFrequency().getInterval()));
        }

        MonitorStatus previous = monitor.getStatus();
        boolean statusChanged = status != null && status != previous;
        if (statusChanged) {
            monitorStateMachine.validateTransition(previous, status);
            if (status == MonitorStatus.ACTIVE
                    && monitorJpaRepository.existsByUserIdAndCompanyIgnoreCaseAndStatusAndIdNot(
                            monitor.getUserId(), monitor.getCompany(), MonitorStatus.ACTIVE, monitorId)) {
                throw new BusinessException(
                        ErrorCode.DUPLICATE_MONITOR,
                        "Active monitor already exists for " + monitor.getCompany(),
                        Map.of("userId", monitor.getUserId(), "company", monitor.getCompany()));
            }
            monitor.setStatus(status);
            if (previous == MonitorStatus.ERROR && status == MonitorStatus.ACTIVE) {
                monitor.setErrorCount(0);
                monitor.setLastError(null);
                monitor.setNextCheck(now);
            }
        }

        Monitor saved = save(monitor);
        if (statusChanged) {
            log.info("Monitor {} status {} -> {}", monitorId, previous, status);
            eventPublisherHelper.publishStatusChanged(this, saved, previous);
        }
        eventPublisherHelper.publishMonitorUpdated(this, saved);
        return saved;
    }

    /** Soft delete. Snapshot and alert history is kept. */
    public Monitor deleteMonitor(String monitorId) {
        Monitor monitor = getMonitor(monitorId);
        MonitorStatus previous = monitor.getStatus();
        monitorStateMachine.validateTransition(previous, MonitorStatus.DELETED);
        monitor.setStatus(MonitorStatus.DELETED);
        Monitor saved = save(monitor);
        anomalyDetector.clearModels(monitorId);
        alertScorer.clear(monitorId);
        eventPublisherHelper.publishStatusChanged(this, saved, previous);
        log.info("Deleted monitor {} ({})", monitorId, saved.getCompany());
        return saved;
    }

    /**
     * Queues an immediate check on the CRITICAL lane.
     *
     * @return the queued task, or null when a check for this monitor is already in flight
     */
    public MonitoringTask forceCheck(String monitorId) {
        Monitor monitor = getMonitor(monitorId);
        if (monitor.getStatus() != MonitorStatus.ACTIVE) {
            throw new BusinessException(
                    ErrorCode.INVALID_STATE_TRANSITION,
                    "Monitor " + monitorId + " is " + monitor.getStatus() + ", only ACTIVE monitors can be checked");
        }
        MonitoringTask task = taskQueue.enqueueIfAbsent(
                TaskType.MONITOR_CHECK, TaskLane.CRITICAL, Map.of(MonitoringTask.MONITOR_ID, monitorId));
        if (task == null) {
            log.info("Check for monitor {} already in flight, force check ignored", monitorId);
        }
        return task;
    }

    // ========================
    // CHECK CYCLE
    // ========================

    /**
     * Runs one check cycle and counts every failure towards the ERROR threshold.
     *
     * @return alerts created in this cycle (sent or suppressed); empty when the monitor is not ACTIVE
     * @throws ResourceNotFoundException when the monitor does not exist
     */
    public List<Alert> checkForUpdates(String monitorId) {
        return checkForUpdates(monitorId, e -> true);
    }

    /**
     * Runs one check cycle.
     *
     * <p>Monitor bookkeeping is written against a fresh read of the row, so a pause or delete
     * that lands while the cycle runs wins and the result is not written back.
     *
     * @param countsAsFailedCheck decides whether a failure is final for this check. A failure
     *     that will be retried is not counted, so ERROR means five failed checks, not attempts.
     */
    public List<Alert> checkForUpdates(String monitorId, Predicate<RuntimeException> countsAsFailedCheck) {
        Monitor monitor = getMonitor(monitorId);
        if (monitor.getStatus() != MonitorStatus.ACTIVE) {
            log.info("Monitor {} is {}, skipping check", monitorId, monitor.getStatus());
            return List.of();
        }

        long started = System.nanoTime();
        List<Alert> alerts;
        try {
            alerts = runCycle(monitor);
        } catch (RuntimeException e) {
            if (countsAsFailedCheck.test(e)) {
                recordFailure(monitorId, e, elapsedMillis(started));
            } else {
                log.warn("Check attempt failed for monitor {}, will be retried: {}", monitorId, e.getMessage());
            }
            throw e;
        }

        Monitor latest = getMonitor(monitorId);
        if (latest.getStatus() != MonitorStatus.ACTIVE) {
            log.info("Monitor {} became {} during its check, result not recorded", monitorId, latest.getStatus());
            return alerts;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        latest.setLastCheck(now);
        latest.setNextCheck(now.plus(latest.getSettings().getFrequency().getInterval()));
        latest.setErrorCount(0);
        latest.setLastError(null);
        for (Alert alert : alerts) {
            if (alert.isNotified()) {
                latest.setTotalAlerts(latest.getTotalAlerts() + 1);
                latest.setLastAlertId(alert.getId());
            }
        }
        Monitor saved = save(latest);

        eventPublisherHelper.publishMonitorChecked(this, saved, elapsedMillis(started));
        log.info("Check complete for monitor {} ({}): {} alerts", monitorId, saved.getCompany(), alerts.size());
        return alerts;
    }

    private List<Alert> runCycle(Monitor monitor) {
        LocalDateTime now = LocalDateTime.now(clock);
        Snapshot previous = snapshotStore.getLatest(monitor.getId());

        AnalysisResult result = analysisEngine.analyze(toRequest(monitor));
        Snapshot current = snapshotStore.put(buildSnapshot(monitor, result, now));

        List<Change> changes = changeDetector.detect(previous, current);
        List<AnomalyScore> anomalies = previous != null ? detectAnomalies(monitor, current) : List.of();

        double threshold = monitor.getSettings().getAlertThreshold();
        List<Change> significant = changes.stream()
                .filter(c -> c.getConfidence() >= threshold)
                .collect(Collectors.toList());
        log.debug("Monitor {}: {} changes ({} significant), {} anomalies",
                monitor.getId(), changes.size(), significant.size(), anomalies.size());

        if (significant.isEmpty() && anomalies.isEmpty()) {
            return List.of();
        }

        Alert alert = buildAlert(monitor, significant, anomalies, now);
        AlertPriority priority = alertScorer.score(alert, monitor.getSettings());
        alert.setPriority(priority);
        enrichWithRootCause(monitor, alert);

        boolean send = alertScorer.shouldSend(alert, priority);
        alert.setNotified(send);
        Alert saved = alertService.save(alert);
        eventPublisherHelper.publishAlertCreated(this, saved, monitor);

        if (send) {
            eventPublisherHelper.publishDispatchRequested(this, saved, monitor);
            log.info("Alert {} for {} sent (score {}, {})",
                    saved.getId(), monitor.getCompany(), priority.getScore(), priority.getUrgencyLevel());
        } else {
            eventPublisherHelper.publishAlertSuppressed(this, saved, monitor);
            log.info("Alert {} for {} suppressed (score {}, {})",
                    saved.getId(), monitor.getCompany(), priority.getScore(), priority.getUrgencyLevel());
        }
        return List.of(saved);
    }

    private void recordFailure(String monitorId, RuntimeException e, long durationMillis) {
        Monitor monitor = getMonitor(monitorId);
        MonitorStatus previous = monitor.getStatus();
        if (previous != MonitorStatus.ACTIVE) {
            log.info("Monitor {} became {} during its check, failure not recorded", monitorId, previous);
            return;
        }
        monitor.setErrorCount(monitor.getErrorCount() + 1);
        monitor.setLastError(e.getMessage());
        if (monitor.getErrorCount() >= MAX_CONSECUTIVE_ERRORS) {
            monitor.setStatus(MonitorStatus.ERROR);
            log.error("Monitor {} moved to ERROR after {} consecutive failures: {}",
                    monitorId, monitor.getErrorCount(), e.getMessage());
        } else {
            log.warn("Check failed for monitor {} ({}/{}): {}",
                    monitorId, monitor.getErrorCount(), MAX_CONSECUTIVE_ERRORS, e.getMessage());
        }
        Monitor saved = save(monitor);
        eventPublisherHelper.publishCheckFailed(this, saved, durationMillis);
        if (saved.getStatus() != previous) {
            eventPublisherHelper.publishStatusChanged(this, saved, previous);
        }
    }

    /**
     * Point anomalies per numeric metric over the history window, a volatility check on
     * news sentiment, and a trend-reversal check on the market-trend count. Any failure
     * degrades to no anomalies.
     */
    private List<AnomalyScore> detectAnomalies(Monitor monitor, Snapshot current) {
        List<AnomalyScore> anomalies = new ArrayList<>();
        try {
            LocalDateTime since = current.getTimestamp().minusDays(anomalyDetectionConfig.getHistoryWindowDays());
            List<Snapshot> history = snapshotStore.getRange(monitor.getId(), since, current.getTimestamp(), 0);
            int minPoints = anomalyDetectionConfig.getMinTrainingPoints();
            if (history.size() < minPoints) {
                log.debug("Monitor {}: {} snapshots in window, need {} for anomaly detection",
                        monitor.getId(), history.size(), minPoints);
                return anomalies;
            }

            Set<String> fitted = modelTrainingService.fitFromHistory(monitor.getId(), history);

            for (String metric : fitted) {
                if (ModelTrainingService.MARKET_TRENDS_METRIC.equals(metric)) {
                    continue;
                }
                Double value = ModelTrainingService.value(current, metric);
                if (value == null) {
                    continue;
                }
                AnomalyScore score = anomalyDetector.detect(monitor.getId(), metric, value, current.getTimestamp());
                if (score != null) {
                    anomalies.add(score);
                }
            }

            AnomalyScore volatility = sentimentVolatility(history, current);
            if (volatility != null) {
                anomalies.add(volatility);
            }

            if (current.getMarketTrends() != null
                    && !current.getMarketTrends().isEmpty()
                    && fitted.contains(ModelTrainingService.MARKET_TRENDS_METRIC)) {
                AnomalyScore reversal = anomalyDetector.toTrendReversalAnomaly(
                        anomalyDetector.analyzeTrend(
                                monitor.getId(),
                                ModelTrainingService.MARKET_TRENDS_METRIC,
                                anomalyDetectionConfig.getTrendRecentWindowDays()),
                        "Market Trends",
                        current.getTimestamp());
                if (reversal != null) {
                    anomalies.add(reversal);
                }
            }
        } catch (RuntimeException e) {
            log.error("Anomaly detection failed for monitor {}", monitor.getId(), e);
            return new ArrayList<>();
        }
        return anomalies;
    }

    private AnomalyScore sentimentVolatility(List<Snapshot> history, Snapshot current) {
        if (current.getNewsSentiment() == null) {
            return null;
        }
        LocalDateTime recentStart = current.getTimestamp().minusDays(anomalyDetectionConfig.getTrendRecentWindowDays());
        List<Double> recent = new ArrayList<>();
        List<Double> historical = new ArrayList<>();
        for (TimeSeriesPoint point : ModelTrainingService.series(history, ModelTrainingService.SENTIMENT_METRIC)) {
            if (point.timestamp().isAfter(recentStart)) {
                recent.add(point.value());
            } else {
                historical.add(point.value());
            }
        }
        recent.add(current.getNewsSentiment());
        return anomalyDetector.detectVolatilitySpike(
                ModelTrainingService.SENTIMENT_METRIC,
                recent.stream().mapToDouble(Double::doubleValue).toArray(),
                historical.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private Alert buildAlert(Monitor monitor, List<Change> significant, List<AnomalyScore> anomalies, LocalDateTime now) {
        double confidence;
        if (!significant.isEmpty()) {
            confidence = significant.stream().mapToDouble(Change::getConfidence).average().orElse(0.0);
        } else if (!anomalies.isEmpty()) {
            confidence = anomalies.stream().mapToDouble(AnomalyScore::getConfidence).average().orElse(0.0);
        } else {
            confidence = DEFAULT_ALERT_CONFIDENCE;
        }

        List<String> parts = new ArrayList<>();
        if (!significant.isEmpty()) {
            Set<String> types = significant.stream()
                    .map(c -> c.getChangeType().name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toCollection(TreeSet::new));
            parts.add(significant.size() + " changes in " + String.join(", ", types));
        }
        if (!anomalies.isEmpty()) {
            parts.add(anomalies.size() + " statistical anomalies");
        }

        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .monitorId(monitor.getId())
                .title("Changes Detected: " + monitor.getCompany())
                .summary("Detected " + String.join(" and ", parts) + " for " + monitor.getCompany())
                .confidence(confidence)
                .changes(new ArrayList<>(significant))
                .anomalyScores(new ArrayList<>(anomalies))
                .createdAt(now)
                .build();
    }

    private void enrichWithRootCause(Monitor monitor, Alert alert) {
        try {
            List<Alert> recent = alertService.listAlerts(monitor.getId(), false, RECENT_ALERT_LOOKBACK);
            RootCauseExplanation explanation = rootCauseAnalyzer.analyze(alert, recent);
            alert.setRootCause(explanation);
            alert.setTitle(explanation.getSeverity().name() + ": " + monitor.getCompany());
            alert.setSummary(explanation.getSummary());
        } catch (RuntimeException e) {
            log.warn("Root cause analysis failed for alert {} (monitor {}): {}",
                    alert.getId(), monitor.getId(), e.getMessage());
        }
    }

    // ========================
    // STATS
    // ========================

    /** Dashboard counters over the owner's non-deleted monitors. */
    public MonitoringStats getStats(String userId) {
        List<MonitorEntity> monitors = monitorJpaRepository.findByUserId(userId).stream()
                .filter(m -> m.getStatus() != MonitorStatus.DELETED)
                .collect(Collectors.toList());
        Map<MonitorStatus, Long> byStatus = monitors.stream()
                .collect(Collectors.groupingBy(MonitorEntity::getStatus, () -> new EnumMap<>(MonitorStatus.class),
                        Collectors.counting()));

        List<String> ids = monitors.stream().map(MonitorEntity::getId).collect(Collectors.toList());
        List<Alert> recent = List.of();
        long unread = 0;
        if (!ids.isEmpty()) {
            List<AlertEntity> entities =
                    alertJpaRepository.findRecentForMonitors(ids, LocalDateTime.now(clock).minusHours(24));
            recent = alertMapper.toDomainList(entities);
            unread = alertJpaRepository.countByMonitorIdInAndReadFalse(ids);
        }

        double avgConfidence = recent.stream().mapToDouble(Alert::getConfidence).average().orElse(0.0);

        Map<ChangeType, Long> typeCounts = new LinkedHashMap<>();
        for (Alert alert : recent) {
            for (Change change : alert.getChanges()) {
                typeCounts.merge(change.getChangeType(), 1L, Long::sum);
            }
        }
        List<ChangeType> topTypes = typeCounts.entrySet().stream()
                .sorted(Map.Entry.<ChangeType, Long>comparingByValue().reversed())
                .limit(TOP_CHANGE_TYPES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        return MonitoringStats.builder()
                .totalMonitors(monitors.size())
                .activeMonitors(byStatus.getOrDefault(MonitorStatus.ACTIVE, 0L).intValue())
                .pausedMonitors(byStatus.getOrDefault(MonitorStatus.PAUSED, 0L).intValue())
                .errorMonitors(byStatus.getOrDefault(MonitorStatus.ERROR, 0L).intValue())
                .totalAlerts24h(recent.size())
                .unreadAlerts((int) unread)
                .avgAlertConfidence(avgConfidence)
                .topChangeTypes(topTypes)
                .build();
    }

    // ========================
    // HELPERS
    // ========================

    private Monitor save(Monitor monitor) {
        return monitorMapper.toDomain(monitorJpaRepository.save(monitorMapper.toEntity(monitor)));
    }

    private static AnalysisRequest toRequest(Monitor monitor) {
        return AnalysisRequest.builder()
                .company(monitor.getCompany())
                .industry(monitor.getIndustry())
                .frameworks(monitor.getSettings().getFrameworks())
                .depth(monitor.getSettings().getAnalysisDepth())
                .build();
    }

    private static Snapshot buildSnapshot(Monitor monitor, AnalysisResult result, LocalDateTime timestamp) {
        return Snapshot.builder()
                .monitorId(monitor.getId())
                .timestamp(timestamp)
                .company(monitor.getCompany())
                .industry(monitor.getIndustry())
                .financialMetrics(copyOf(result.getFinancialMetrics()))
                .marketTrends(result.getMarketTrends() != null
                        ? new ArrayList<>(result.getMarketTrends())
                        : new ArrayList<>())
                .competitiveForces(copyOf(result.getCompetitiveForces()))
                .strategicPosition(copyOf(result.getStrategicPosition()))
                .newsSentiment(result.getNewsSentiment())
                .competitorMentions(copyOf(result.getCompetitorMentions()))
                .build();
    }

    private static <V> Map<String, V> copyOf(Map<String, V> source) {
        return source != null ? new LinkedHashMap<>(source) : new LinkedHashMap<>();
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}

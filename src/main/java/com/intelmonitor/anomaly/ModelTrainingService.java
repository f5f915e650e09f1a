package com.intelmonitor.anomaly;

import com.intelmonitor.config.AnomalyDetectionConfig;
import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.entity.MonitorEntity;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.snapshot.SnapshotStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds per-metric series from snapshot history and fits the monitor's forecast models.
 *
 * <p>Used by the check cycle on each run and by the weekly retraining job, which also
 * drops models for metrics that no longer appear in the history.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    public static final String MARKET_TRENDS_METRIC = "market_trends_count";
    public static final String SENTIMENT_METRIC = "news_sentiment";

    private final AnomalyDetector anomalyDetector;
    private final SnapshotStore snapshotStore;
    private final MonitorJpaRepository monitorJpaRepository;
    private final AnomalyDetectionConfig anomalyDetectionConfig;
    private final Clock clock;

    public ModelTrainingService(
            AnomalyDetector anomalyDetector,
            SnapshotStore snapshotStore,
            MonitorJpaRepository monitorJpaRepository,
            AnomalyDetectionConfig anomalyDetectionConfig,
            Clock clock) {
        this.anomalyDetector = anomalyDetector;
        this.snapshotStore = snapshotStore;
        this.monitorJpaRepository = monitorJpaRepository;
        this.anomalyDetectionConfig = anomalyDetectionConfig;
        this.clock = clock;
    }

    /**
     * Fits every numeric metric found in {@code history}, plus the market-trend count.
     *
     * @return names of the metrics whose model was fitted
     */
    public Set<String> fitFromHistory(String monitorId, List<Snapshot> history) {
        Set<String> fitted = new LinkedHashSet<>();
        for (String metric : metricNames(history)) {
            if (anomalyDetector.fit(monitorId, metric, series(history, metric))) {
                fitted.add(metric);
            }
        }
        return fitted;
    }

    /** Refits one monitor from its history window, discarding its previous models. */
    public int retrain(String monitorId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Snapshot> history = snapshotStore.getRange(
                monitorId, now.minusDays(anomalyDetectionConfig.getHistoryWindowDays()), now, 0);
        anomalyDetector.clearModels(monitorId);
        if (history.size() < anomalyDetectionConfig.getMinTrainingPoints()) {
            log.debug("Skipping retraining for monitor {}: {} snapshots", monitorId, history.size());
            return 0;
        }
        return fitFromHistory(monitorId, history).size();
    }

    /**
     * Weekly job over all active monitors.
     *
     * @return total models fitted
     */
    public int retrainAll() {
        List<MonitorEntity> active = monitorJpaRepository.findByStatus(MonitorStatus.ACTIVE);
        int models = 0;
        for (MonitorEntity monitor : active) {
            try {
                models += retrain(monitor.getId());
            } catch (RuntimeException e) {
                log.warn("Retraining failed for monitor {}: {}", monitor.getId(), e.getMessage());
            }
        }
        log.info("Model retraining complete: {} models across {} monitors", models, active.size());
        return models;
    }

    /** Values of one metric across the snapshots, skipping snapshots where it is not numeric. */
    public static List<TimeSeriesPoint> series(List<Snapshot> snapshots, String metric) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (Snapshot snapshot : snapshots) {
            Double value = value(snapshot, metric);
            if (value != null) {
                points.add(new TimeSeriesPoint(snapshot.getTimestamp(), value));
            }
        }
        return points;
    }

    public static Double value(Snapshot snapshot, String metric) {
        if (MARKET_TRENDS_METRIC.equals(metric)) {
            return snapshot.getMarketTrends() != null ? (double) snapshot.getMarketTrends().size() : 0.0;
        }
        return SnapshotStore.numericValue(snapshot, metric);
    }

    private static Set<String> metricNames(List<Snapshot> history) {
        Set<String> names = new TreeSet<>();
        for (Snapshot snapshot : history) {
            if (snapshot.getFinancialMetrics() != null) {
                snapshot.getFinancialMetrics().forEach((name, value) -> {
                    if (value instanceof Number) {
                        names.add(name);
                    }
                });
            }
        }
        names.add(SENTIMENT_METRIC);
        names.add(MARKET_TRENDS_METRIC);
        return names;
    }
}

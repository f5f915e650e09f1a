package com.intelmonitor.unit.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.intelmonitor.anomaly.AnomalyDetector;
import com.intelmonitor.anomaly.ModelTrainingService;
import com.intelmonitor.anomaly.SeasonalTrendForecastModelFactory;
import com.intelmonitor.config.AnomalyDetectionConfig;
import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.entity.MonitorEntity;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.snapshot.SnapshotStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ModelTrainingServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 2, 1, 8, 0);

    private AnomalyDetector anomalyDetector;
    private SnapshotStore snapshotStore;
    private MonitorJpaRepository monitorJpaRepository;
    private ModelTrainingService modelTrainingService;

    @BeforeEach
    void setUp() {
        AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        anomalyDetector = new AnomalyDetector(new SeasonalTrendForecastModelFactory(config), config, clock);
        snapshotStore = mock(SnapshotStore.class);
        monitorJpaRepository = mock(MonitorJpaRepository.class);
        modelTrainingService =
                new ModelTrainingService(anomalyDetector, snapshotStore, monitorJpaRepository, config, clock);
    }

    private static List<Snapshot> history(int days, boolean withSentiment) {
        List<Snapshot> snapshots = new ArrayList<>();
        for (int day = days; day > 0; day--) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("revenue", 1_000_000.0 + day * 1_000);
            metrics.put("employees", 500 + day);
            metrics.put("ceo", "J. Smith");
            snapshots.add(Snapshot.builder()
                    .monitorId("m1")
                    .timestamp(NOW.minusDays(day))
                    .financialMetrics(metrics)
                    .marketTrends(new ArrayList<>(List.of("AI adoption", "cloud migration").subList(0, 1 + day % 2)))
                    .newsSentiment(withSentiment ? 0.2 + (day % 3) * 0.1 : null)
                    .build());
        }
        return snapshots;
    }

    @Nested
    @DisplayName("Fitting from history")
    class FitFromHistory {

        @Test
        @DisplayName("Numeric metrics, sentiment and market-trend count are fitted; text metrics are not")
        void fitsNumericMetrics() {
            Set<String> fitted = modelTrainingService.fitFromHistory("m1", history(20, true));

            assertThat(fitted)
                    .containsExactlyInAnyOrder(
                            "revenue",
                            "employees",
                            ModelTrainingService.SENTIMENT_METRIC,
                            ModelTrainingService.MARKET_TRENDS_METRIC);
            assertThat(anomalyDetector.hasModel("m1", "ceo")).isFalse();
        }

        @Test
        @DisplayName("Sentiment is skipped when no snapshot carries it")
        void sentimentSkippedWhenMissing() {
            Set<String> fitted = modelTrainingService.fitFromHistory("m1", history(20, false));

            assertThat(fitted).doesNotContain(ModelTrainingService.SENTIMENT_METRIC);
        }

        @Test
        @DisplayName("Market-trend count is the number of trends in each snapshot")
        void marketTrendCountValue() {
            Snapshot snapshot = Snapshot.builder().marketTrends(List.of("a", "b", "c")).build();

            assertThat(ModelTrainingService.value(snapshot, ModelTrainingService.MARKET_TRENDS_METRIC))
                    .isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("Retraining")
    class Retraining {

        @Test
        @DisplayName("Retrain replaces the monitor's models from the history window")
        void retrainReplacesModels() {
            anomalyDetector.fit("m1", "stale_metric", history(20, true).stream()
                    .map(s -> new TimeSeriesPoint(s.getTimestamp(), 1.0))
                    .toList());
            when(snapshotStore.getRange(eq("m1"), eq(NOW.minusDays(30)), eq(NOW), eq(0)))
                    .thenReturn(history(20, true));

            int models = modelTrainingService.retrain("m1");

            assertThat(models).isEqualTo(4);
            assertThat(anomalyDetector.hasModel("m1", "stale_metric")).isFalse();
            assertThat(anomalyDetector.hasModel("m1", "revenue")).isTrue();
        }

        @Test
        @DisplayName("Short history clears the models and fits nothing")
        void shortHistory() {
            when(snapshotStore.getRange(eq("m1"), any(), any(), eq(0))).thenReturn(history(5, true));

            assertThat(modelTrainingService.retrain("m1")).isZero();
            assertThat(anomalyDetector.getModelCount()).isZero();
        }

        @Test
        @DisplayName("retrainAll covers every active monitor and survives a failing one")
        void retrainAllSurvivesFailure() {
            MonitorEntity good = MonitorEntity.builder().id("m1").status(MonitorStatus.ACTIVE).build();
            MonitorEntity bad = MonitorEntity.builder().id("m2").status(MonitorStatus.ACTIVE).build();
            when(monitorJpaRepository.findByStatus(MonitorStatus.ACTIVE)).thenReturn(List.of(bad, good));
            when(snapshotStore.getRange(eq("m2"), any(), any(), eq(0))).thenThrow(new IllegalStateException("boom"));
            when(snapshotStore.getRange(eq("m1"), any(), any(), eq(0))).thenReturn(history(20, true));

            assertThat(modelTrainingService.retrainAll()).isEqualTo(4);
        }
    }
}

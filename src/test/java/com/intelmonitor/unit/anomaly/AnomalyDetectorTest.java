package com.intelmonitor.unit.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.intelmonitor.anomaly.AnomalyDetector;
import com.intelmonitor.anomaly.DetectionContext;
import com.intelmonitor.anomaly.Forecast;
import com.intelmonitor.anomaly.SeasonalTrendForecastModel;
import com.intelmonitor.anomaly.SeasonalTrendForecastModelFactory;
import com.intelmonitor.config.AnomalyDetectionConfig;
import com.intelmonitor.domain.enums.AnomalyType;
import com.intelmonitor.domain.enums.TrendDirection;
import com.intelmonitor.domain.model.AnomalyScore;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.domain.model.TrendAnalysis;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnomalyDetector covering model fitting, point, contextual, trend
 * reversal and volatility detection, and per-monitor model isolation.
 */
class AnomalyDetectorTest {

    private static final LocalDateTime ORIGIN = LocalDateTime.of(2025, 1, 1, 9, 0);
    private static final LocalDateTime NOW = ORIGIN.plusDays(29);

    private AnomalyDetectionConfig config;
    private AnomalyDetector anomalyDetector;

    @BeforeEach
    void setUp() {
        config = new AnomalyDetectionConfig();
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        anomalyDetector = new AnomalyDetector(new SeasonalTrendForecastModelFactory(config), config, clock);
    }

    /** 30 daily revenue values of $1M with uniform noise of up to 5%. */
    private static List<TimeSeriesPoint> revenueSeries() {
        Random random = new Random(42);
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int day = 0; day < 30; day++) {
            double noise = (random.nextDouble() * 2.0 - 1.0) * 0.05;
            points.add(new TimeSeriesPoint(ORIGIN.plusDays(day), 1_000_000 * (1.0 + noise)));
        }
        return points;
    }

    @Nested
    @DisplayName("Model fitting")
    class Fitting {

        @Test
        @DisplayName("Fewer than 14 valid points leaves the metric without a model")
        void insufficientPoints() {
            List<TimeSeriesPoint> series = revenueSeries().subList(0, 13);

            assertThat(anomalyDetector.fit("m1", "revenue", series)).isFalse();
            assertThat(anomalyDetector.hasModel("m1", "revenue")).isFalse();
            assertThat(anomalyDetector.detect("m1", "revenue", 5_000_000, NOW)).isNull();
        }

        @Test
        @DisplayName("NaN values are dropped before counting training points")
        void nanValuesDropped() {
            List<TimeSeriesPoint> series = new ArrayList<>(revenueSeries().subList(0, 13));
            series.add(new TimeSeriesPoint(ORIGIN.plusDays(13), Double.NaN));

            assertThat(anomalyDetector.fit("m1", "revenue", series)).isFalse();
        }

        @Test
        @DisplayName("Models are scoped per monitor")
        void modelsScopedPerMonitor() {
            anomalyDetector.fit("m1", "revenue", revenueSeries());

            assertThat(anomalyDetector.hasModel("m1", "revenue")).isTrue();
            assertThat(anomalyDetector.hasModel("m2", "revenue")).isFalse();
            assertThat(anomalyDetector.detect("m2", "revenue", 5_000_000, NOW)).isNull();

            anomalyDetector.clearModels("m1");
            assertThat(anomalyDetector.getModelCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Point anomalies")
    class PointAnomalies {

        @Test
        @DisplayName("The forecast midpoint is never anomalous")
        void midpointNotAnomalous() {
            List<TimeSeriesPoint> series = revenueSeries();
            anomalyDetector.fit("m1", "revenue", series);
            SeasonalTrendForecastModel reference = new SeasonalTrendForecastModel(config.getSeasonalityPeriodDays());
            reference.fit(series);

            for (int offset = 0; offset < 7; offset++) {
                LocalDateTime at = NOW.plusDays(offset);
                Forecast forecast = reference.predict(at, config.getSensitivity().getIntervalWidth());

                assertThat(anomalyDetector.detect("m1", "revenue", forecast.yhat(), at)).isNull();
            }
        }

        @Test
        @DisplayName("$1M +/-5% history then $1.5M scores severity above 5 and confidence above 0.5")
        void revenueJumpFlagged() {
            anomalyDetector.fit("m1", "revenue", revenueSeries());

            AnomalyScore score = anomalyDetector.detect("m1", "revenue", 1_500_000, NOW.plusDays(1));

            assertThat(score).isNotNull();
            assertThat(score.getAnomalyType()).isEqualTo(AnomalyType.POINT);
            assertThat(score.getSeverity()).isGreaterThan(5.0).isLessThanOrEqualTo(10.0);
            assertThat(score.getConfidence()).isGreaterThan(0.5).isLessThanOrEqualTo(1.0);
            assertThat(score.getStatisticalDetails()).containsEntry("direction", "above");
            assertThat(score.getActualValue()).isEqualTo(1_500_000);
        }

        @Test
        @DisplayName("Severity does not decrease as the deviation grows")
        void severityMonotonicInDeviation() {
            anomalyDetector.fit("m1", "revenue", revenueSeries());

            double previous = 0.0;
            for (double value = 1_100_000; value <= 2_000_000; value += 100_000) {
                AnomalyScore score = anomalyDetector.detect("m1", "revenue", value, NOW.plusDays(1));
                double severity = score != null ? score.getSeverity() : 0.0;
                assertThat(severity).isGreaterThanOrEqualTo(previous);
                previous = severity;
            }
        }
    }

    @Nested
    @DisplayName("Context adjustments")
    class ContextAdjustments {

        @Test
        @DisplayName("Context severity is monotonic in z and clamped to 10")
        void contextSeverityMonotonic() {
            DetectionContext context = DetectionContext.builder().marketHours(true).build();

            double previous = -1.0;
            for (double z = 0.0; z <= 8.0; z += 0.5) {
                double severity = anomalyDetector.calculateSeverity(z, context);
                assertThat(severity).isGreaterThanOrEqualTo(previous).isBetween(0.0, 10.0);
                previous = severity;
            }
        }

        @Test
        @DisplayName("Earnings day damps and holiday period damps further")
        void earningsAndHolidayDamp() {
            DetectionContext earnings = DetectionContext.builder().earningsDay(true).build();
            DetectionContext both = DetectionContext.builder().earningsDay(true).holidayPeriod(true).build();

            assertThat(anomalyDetector.calculateSeverity(2.0, earnings)).isCloseTo(2.8, within(1e-9));
            assertThat(anomalyDetector.calculateSeverity(2.0, both)).isLessThan(2.8);
        }

        @Test
        @DisplayName("Market-closed deviations become CONTEXTUAL and are amplified")
        void marketClosedAmplifies() {
            anomalyDetector.fit("m1", "revenue", revenueSeries());
            DetectionContext closed = DetectionContext.builder().marketClosed(true).build();

            AnomalyScore plain = anomalyDetector.detect("m1", "revenue", 1_080_000, NOW.plusDays(1));
            AnomalyScore contextual =
                    anomalyDetector.detectWithContext("m1", "revenue", 1_080_000, NOW.plusDays(1), closed);

            if (plain != null) {
                assertThat(contextual.getAnomalyType()).isEqualTo(AnomalyType.CONTEXTUAL);
                assertThat(contextual.getSeverity()).isGreaterThanOrEqualTo(plain.getSeverity());
                assertThat(contextual.getExplanation()).contains("during market close");
            } else {
                assertThat(contextual).isNull();
            }
        }
    }

    @Nested
    @DisplayName("Trend reversal")
    class TrendReversal {

        @Test
        @DisplayName("Rising then falling series is reported as a reversal")
        void reversalDetected() {
            List<TimeSeriesPoint> series = new ArrayList<>();
            for (int day = 0; day < 30; day++) {
                double value = day <= 22 ? 100 + 50.0 * day : 1200 - 100.0 * (day - 22);
                series.add(new TimeSeriesPoint(ORIGIN.plusDays(day), value));
            }
            anomalyDetector.fit("m1", "market_trends_count", series);

            TrendAnalysis analysis = anomalyDetector.analyzeTrend("m1", "market_trends_count", 7);

            assertThat(analysis).isNotNull();
            assertThat(analysis.getHistoricalTrend()).isEqualTo(TrendDirection.UP);
            assertThat(analysis.getCurrentTrend()).isEqualTo(TrendDirection.DOWN);
            assertThat(analysis.isReversalDetected()).isTrue();

            AnomalyScore score = anomalyDetector.toTrendReversalAnomaly(analysis, "Market Trends", NOW);
            assertThat(score.getAnomalyType()).isEqualTo(AnomalyType.TREND_REVERSAL);
            assertThat(score.getExplanation()).startsWith("Market Trends trend direction changed");
        }

        @Test
        @DisplayName("Steady series has no reversal")
        void steadySeriesNoReversal() {
            List<TimeSeriesPoint> series = new ArrayList<>();
            for (int day = 0; day < 30; day++) {
                series.add(new TimeSeriesPoint(ORIGIN.plusDays(day), 100 + 20.0 * day));
            }
            anomalyDetector.fit("m1", "revenue", series);

            TrendAnalysis analysis = anomalyDetector.analyzeTrend("m1", "revenue", 7);

            assertThat(analysis.isReversalDetected()).isFalse();
            assertThat(anomalyDetector.toTrendReversalAnomaly(analysis, "Revenue", NOW)).isNull();
        }

        @Test
        @DisplayName("No model means no trend analysis")
        void noModel() {
            assertThat(anomalyDetector.analyzeTrend("m1", "revenue", 7)).isNull();
        }
    }

    @Nested
    @DisplayName("Volatility spikes")
    class VolatilitySpikes {

        private final double[] calm = {0.50, 0.52, 0.49, 0.51, 0.50, 0.48, 0.52, 0.50, 0.51, 0.49};

        @Test
        @DisplayName("Recent stddev above twice the historical one is flagged")
        void spikeFlagged() {
            double[] recent = {0.1, 0.9, 0.2, 0.8};

            AnomalyScore score = anomalyDetector.detectVolatilitySpike("news_sentiment", recent, calm);

            assertThat(score).isNotNull();
            assertThat(score.getAnomalyType()).isEqualTo(AnomalyType.VOLATILITY_SPIKE);
            assertThat(score.getSeverity()).isEqualTo(10.0);
            assertThat(score.getActualValue()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("Similar volatility is not flagged")
        void similarVolatilityIgnored() {
            double[] recent = {0.50, 0.52, 0.48};

            assertThat(anomalyDetector.detectVolatilitySpike("news_sentiment", recent, calm)).isNull();
        }

        @Test
        @DisplayName("Too few values yields no score")
        void tooFewValues() {
            assertThat(anomalyDetector.detectVolatilitySpike("news_sentiment", new double[] {0.1, 0.9}, calm)).isNull();
            assertThat(anomalyDetector.detectVolatilitySpike(
                            "news_sentiment", new double[] {0.1, 0.9, 0.2}, new double[] {0.5, 0.5}))
                    .isNull();
        }
    }
}

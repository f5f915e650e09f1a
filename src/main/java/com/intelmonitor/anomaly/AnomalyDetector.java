package com.intelmonitor.anomaly;

import com.intelmonitor.config.AnomalyDetectionConfig;
import com.intelmonitor.domain.enums.AnomalyType;
import com.intelmonitor.domain.enums.TrendDirection;
import com.intelmonitor.domain.model.AnomalyScore;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.domain.model.TrendAnalysis;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Forecast-based anomaly detection over numeric snapshot metrics.
 *
 * <p>One {@link ForecastModel} is cached per (scope, metric), where the scope is the
 * owning monitor id, so monitors tracking the same metric name never share a model.
 *
 * <p>Detection modes:
 * <ul>
 *   <li>Point: value outside the forecast interval. With {@code sigma = (upper - lower) / 4}
 *       and {@code z = |value - yhat| / sigma}: severity = min(10, 2z), confidence = min(1, z/5)</li>
 *   <li>Contextual: point detection post-processed with caller-supplied period context</li>
 *   <li>Trend reversal: older vs recent mean slope of the model's trend component</li>
 *   <li>Volatility spike: recent population stddev above 2x the historical one</li>
 * </ul>
 *
 * <p>A metric without a fitted model yields no score; insufficient history is a
 * degraded mode, not an error.
 */
@Service
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private static final int TREND_HISTORY_DAYS = 30;
    private static final int TREND_FORECAST_DAYS = 7;
    private static final double STABLE_SLOPE_FRACTION = 0.05;
    private static final double STABLE_SLOPE_FLOOR = 0.01;
    private static final double VOLATILITY_SPIKE_RATIO = 2.0;
    private static final int VOLATILITY_MIN_RECENT = 3;
    private static final int VOLATILITY_MIN_HISTORICAL = 10;

    private final ForecastModelFactory forecastModelFactory;
    private final AnomalyDetectionConfig anomalyDetectionConfig;
    private final Clock clock;

    private final Map<ModelKey, ForecastModel> models = new ConcurrentHashMap<>();

    public AnomalyDetector(
            ForecastModelFactory forecastModelFactory, AnomalyDetectionConfig anomalyDetectionConfig, Clock clock) {
        this.forecastModelFactory = forecastModelFactory;
        this.anomalyDetectionConfig = anomalyDetectionConfig;
        this.clock = clock;
    }

    /**
     * Fits (or refits) the model for a metric. NaN and infinite values are discarded first.
     *
     * @return false when fewer than the minimum number of valid points remain or the fit fails
     */
    public boolean fit(String scope, String metricName, List<TimeSeriesPoint> series) {
        ModelKey key = new ModelKey(scope, metricName);
        List<TimeSeriesPoint> valid = series == null
                ? List.of()
                : series.stream()
                        .filter(p -> p.timestamp() != null && Double.isFinite(p.value()))
                        .toList();

        if (valid.size() < anomalyDetectionConfig.getMinTrainingPoints()) {
            log.warn(
                    "Insufficient history for {}/{}: {} valid points, need {}",
                    scope,
                    metricName,
                    valid.size(),
                    anomalyDetectionConfig.getMinTrainingPoints());
            models.remove(key);
            return false;
        }

        ForecastModel model = forecastModelFactory.create();
        try {
            model.fit(valid);
        } catch (RuntimeException e) {
            log.warn("Model training failed for {}/{}: {}", scope, metricName, e.getMessage());
            models.remove(key);
            return false;
        }
        models.put(key, model);
        log.debug("Fitted model for {}/{} on {} points", scope, metricName, valid.size());
        return true;
    }

    /**
     * Point anomaly check. Returns null when no model is fitted or the value lies
     * inside the forecast interval (bounds inclusive).
     */
    public AnomalyScore detect(String scope, String metricName, double value, LocalDateTime timestamp) {
        ForecastModel model = models.get(new ModelKey(scope, metricName));
        if (model == null) {
            log.debug("No model for {}/{}, skipping detection", scope, metricName);
            return null;
        }

        Forecast forecast = model.predict(timestamp, anomalyDetectionConfig.getSensitivity().getIntervalWidth());
        if (value >= forecast.lower() && value <= forecast.upper()) {
            return null;
        }

        double forecastStd = (forecast.upper() - forecast.lower()) / 4.0;
        double zScore = Math.abs(value - forecast.yhat()) / forecastStd;
        double severity = Math.min(10.0, zScore * 2.0);
        double confidence = Math.min(1.0, zScore / 5.0);
        String direction = value > forecast.yhat() ? "above" : "below";
        double deviationPct =
                forecast.yhat() != 0.0 ? Math.abs((value - forecast.yhat()) / forecast.yhat()) * 100.0 : 0.0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("z_score", zScore);
        details.put("deviation_pct", deviationPct);
        details.put("forecast_std", forecastStd);
        details.put("direction", direction);

        return AnomalyScore.builder()
                .metricName(metricName)
                .anomalyType(AnomalyType.POINT)
                .severity(severity)
                .confidence(confidence)
                .explanation(String.format(
                        Locale.ROOT,
                        "%s is %.1f%% %s forecast (%.2f vs %.2f, %.1fσ)",
                        metricName,
                        deviationPct,
                        direction,
                        value,
                        forecast.yhat(),
                        zScore))
                .forecastValue(forecast.yhat())
                .actualValue(value)
                .lowerBound(forecast.lower())
                .upperBound(forecast.upper())
                .timestamp(timestamp)
                .statisticalDetails(details)
                .build();
    }

    /**
     * Point detection adjusted for known high-variance periods.
     *
     * <p>Earnings-day deviations below severity 7 are expected and dropped. Deviations
     * while the market is closed are amplified by 1.5x. Any context turns the result
     * into a CONTEXTUAL anomaly.
     */
    public AnomalyScore detectWithContext(
            String scope, String metricName, double value, LocalDateTime timestamp, DetectionContext context) {
        AnomalyScore base = detect(scope, metricName, value, timestamp);
        if (base == null || context == null || context.isEmpty()) {
            return base;
        }
        if (context.isEarningsDay() && base.getSeverity() < 7.0) {
            log.debug("Dropping {} anomaly on earnings day (severity {})", metricName, base.getSeverity());
            return null;
        }

        double zScore = ((Number) base.getStatisticalDetails().get("z_score")).doubleValue();
        double severity = calculateSeverity(zScore, context);
        StringBuilder explanation = new StringBuilder(base.getExplanation());
        if (context.isEarningsDay()) {
            explanation.append(" (unusual even for earnings day)");
        }
        if (context.isMarketClosed()) {
            severity = Math.min(10.0, severity * 1.5);
            explanation.append(" (during market close)");
        }

        return base.toBuilder()
                .anomalyType(AnomalyType.CONTEXTUAL)
                .severity(severity)
                .explanation(explanation.toString())
                .build();
    }

    /**
     * Severity for a z-score under a context: 2z, then x0.7 on earnings days, x1.2 in
     * market hours, x0.8 in holiday periods, clamped to 0-10.
     */
    public double calculateSeverity(double zScore, DetectionContext context) {
        double severity = zScore * 2.0;
        if (context != null) {
            if (context.isEarningsDay()) {
                severity *= 0.7;
            }
            if (context.isMarketHours()) {
                severity *= 1.2;
            }
            if (context.isHolidayPeriod()) {
                severity *= 0.8;
            }
        }
        return Math.max(0.0, Math.min(10.0, severity));
    }

    /**
     * Compares the mean day-over-day slope of the model's trend in an older window
     * (30 days back up to the recent window) with the recent window.
     *
     * @return null when no model is fitted or the windows are too short
     */
    public TrendAnalysis analyzeTrend(String scope, String metricName, int recentWindowDays) {
        ForecastModel model = models.get(new ModelKey(scope, metricName));
        if (model == null) {
            return null;
        }
        int split = TREND_HISTORY_DAYS - recentWindowDays;
        if (recentWindowDays < 2 || split < 2) {
            log.warn("Trend window {} days out of range for {}/{}", recentWindowDays, scope, metricName);
            return null;
        }

        LocalDateTime start = LocalDateTime.now(clock).minusDays(TREND_HISTORY_DAYS);
        double width = anomalyDetectionConfig.getSensitivity().getIntervalWidth();
        double[] trend = new double[TREND_HISTORY_DAYS + TREND_FORECAST_DAYS + 1];
        for (int day = 0; day < trend.length; day++) {
            trend[day] = model.predict(start.plusDays(day), width).trend();
        }

        double historicalSlope = meanDiff(trend, 0, split);
        double currentSlope = meanDiff(trend, split, TREND_HISTORY_DAYS);

        double level = 0.0;
        for (int day = 0; day < TREND_HISTORY_DAYS; day++) {
            level += trend[day];
        }
        level = Math.abs(level / TREND_HISTORY_DAYS);
        double stableThreshold = level == 0.0 ? STABLE_SLOPE_FLOOR : level * STABLE_SLOPE_FRACTION;

        TrendDirection historical = classify(historicalSlope, stableThreshold);
        TrendDirection current = classify(currentSlope, stableThreshold);
        boolean reversal = historical != current
                && historical != TrendDirection.STABLE
                && current != TrendDirection.STABLE;

        double strength = Math.min(
                1.0, Math.abs(currentSlope) / (Math.max(Math.abs(currentSlope), Math.abs(historicalSlope)) + 0.001));
        double reversalConfidence = reversal ? Math.min(1.0, strength * 1.5) : 0.0;

        return TrendAnalysis.builder()
                .metricName(metricName)
                .currentTrend(current)
                .historicalTrend(historical)
                .currentSlope(currentSlope)
                .historicalSlope(historicalSlope)
                .trendStrength(strength)
                .reversalDetected(reversal)
                .reversalConfidence(reversalConfidence)
                .build();
    }

    /** Turns a detected reversal into a TREND_REVERSAL score, or null when none was detected. */
    public AnomalyScore toTrendReversalAnomaly(TrendAnalysis analysis, String displayName, LocalDateTime timestamp) {
        if (analysis == null || !analysis.isReversalDetected()) {
            return null;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("historical_slope", analysis.getHistoricalSlope());
        details.put("current_slope", analysis.getCurrentSlope());
        details.put("trend_strength", analysis.getTrendStrength());

        return AnomalyScore.builder()
                .metricName(analysis.getMetricName())
                .anomalyType(AnomalyType.TREND_REVERSAL)
                .severity(Math.min(10.0, analysis.getReversalConfidence() * 10.0))
                .confidence(analysis.getReversalConfidence())
                .explanation(String.format(
                        "%s trend direction changed from %s to %s",
                        displayName,
                        analysis.getHistoricalTrend().getLabel(),
                        analysis.getCurrentTrend().getLabel()))
                .timestamp(timestamp)
                .statisticalDetails(details)
                .build();
    }

    /**
     * Flags a volatility spike when the recent population stddev exceeds twice the
     * historical one. Needs at least 3 recent and 10 historical values.
     */
    public AnomalyScore detectVolatilitySpike(String metricName, double[] recentValues, double[] historicalValues) {
        if (recentValues == null
                || historicalValues == null
                || recentValues.length < VOLATILITY_MIN_RECENT
                || historicalValues.length < VOLATILITY_MIN_HISTORICAL) {
            return null;
        }

        StandardDeviation population = new StandardDeviation(false);
        double recentStd = population.evaluate(recentValues);
        double historicalStd = population.evaluate(historicalValues);
        if (historicalStd == 0.0 || recentStd <= VOLATILITY_SPIKE_RATIO * historicalStd) {
            return null;
        }

        double increasePct = (recentStd / historicalStd - 1.0) * 100.0;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recent_std", recentStd);
        details.put("historical_std", historicalStd);
        details.put("increase_pct", increasePct);

        return AnomalyScore.builder()
                .metricName(metricName)
                .anomalyType(AnomalyType.VOLATILITY_SPIKE)
                .severity(Math.min(10.0, increasePct / 10.0))
                .confidence(Math.min(1.0, increasePct / 200.0))
                .explanation(String.format(
                        Locale.ROOT,
                        "%s volatility increased %.0f%% (recent σ=%.2f vs historical σ=%.2f)",
                        metricName,
                        increasePct,
                        recentStd,
                        historicalStd))
                .actualValue(recentValues[recentValues.length - 1])
                .timestamp(LocalDateTime.now(clock))
                .statisticalDetails(details)
                .build();
    }

    public boolean hasModel(String scope, String metricName) {
        return models.containsKey(new ModelKey(scope, metricName));
    }

    /** Drops every cached model of one scope. */
    public void clearModels(String scope) {
        models.keySet().removeIf(key -> key.scope().equals(scope));
    }

    public void clearModels() {
        models.clear();
    }

    public int getModelCount() {
        return models.size();
    }

    private static double meanDiff(double[] values, int fromInclusive, int toExclusive) {
        int diffs = toExclusive - fromInclusive - 1;
        if (diffs <= 0) {
            return 0.0;
        }
        return (values[toExclusive - 1] - values[fromInclusive]) / diffs;
    }

    private static TrendDirection classify(double slope, double stableThreshold) {
        if (Math.abs(slope) < stableThreshold) {
            return TrendDirection.STABLE;
        }
        return slope > 0 ? TrendDirection.UP : TrendDirection.DOWN;
    }

    private record ModelKey(String scope, String metric) {}
}

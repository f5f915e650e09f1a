package com.intelmonitor.snapshot;

import com.intelmonitor.domain.enums.TrendDirection;
import com.intelmonitor.domain.model.SeriesDerivative;
import com.intelmonitor.domain.model.SeriesExport;
import com.intelmonitor.domain.model.SeriesTrend;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Analytics over a single metric series read through {@link SnapshotStore#getTrendData}.
 *
 * <p>Derivatives: growth rate is the relative change per day against the previous point,
 * acceleration the change of growth rate per day. Rolling mean and population standard
 * deviation use the last 7/30/60/90 points.
 *
 * <p>Trend: least-squares fit over days since the first point. R² below 0.3 is VOLATILE,
 * |slope| below 0.5 per day is STABLE, otherwise UP or DOWN. An inflection point is a point
 * where the sign of the step before it differs from the sign of the step after it.
 */
@Service
public class TimeSeriesAnalytics {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesAnalytics.class);

    static final int MIN_TREND_POINTS = 3;
    static final double VOLATILE_R_SQUARED = 0.3;
    static final double STABLE_SLOPE_PER_DAY = 0.5;

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final int MIN_ROLLING_POINTS = 3;

    private final SnapshotStore snapshotStore;
    private final Clock clock;

    public TimeSeriesAnalytics(SnapshotStore snapshotStore, Clock clock) {
        this.snapshotStore = snapshotStore;
        this.clock = clock;
    }

    /** Per-point derivatives over the last {@code days} days; empty below two points. */
    public List<SeriesDerivative> calculateDerivatives(String monitorId, String metric, int days) {
        List<TimeSeriesPoint> points = snapshotStore.getTrendData(monitorId, days, metric);
        if (points.size() < 2) {
            log.debug("Not enough {} points for monitor {} to derive ({} found)", metric, monitorId, points.size());
            return List.of();
        }
        return derivatives(points);
    }

    /** Trend over the last {@code days} days, or null below three points. */
    public SeriesTrend detectTrend(String monitorId, String metric, int days) {
        List<TimeSeriesPoint> points = snapshotStore.getTrendData(monitorId, days, metric);
        SeriesTrend trend = trend(points);
        if (trend == null) {
            return null;
        }
        trend.setMonitorId(monitorId);
        trend.setMetricName(metric);
        trend.setPeriodDays(days);
        trend.setAnalyzedAt(LocalDateTime.now(clock));
        return trend;
    }

    /** Columns for charting the last {@code days} days, or null when the series is empty. */
    public SeriesExport exportForVisualization(String monitorId, String metric, int days) {
        List<TimeSeriesPoint> points = snapshotStore.getTrendData(monitorId, days, metric);
        if (points.isEmpty()) {
            return null;
        }
        LocalDateTime end = LocalDateTime.now(clock);
        SeriesExport export = SeriesExport.builder()
                .monitorId(monitorId)
                .metricName(metric)
                .timestamps(points.stream().map(TimeSeriesPoint::timestamp).toList())
                .values(points.stream().map(TimeSeriesPoint::value).toList())
                .periodStart(end.minusDays(days))
                .periodEnd(end)
                .dataPoints(points.size())
                .build();

        if (points.size() >= 2) {
            List<SeriesDerivative> derivatives = derivatives(points);
            export.setGrowthRates(derivatives.stream().map(SeriesDerivative::getGrowthRate).toList());
            export.setAccelerations(derivatives.stream().map(SeriesDerivative::getAcceleration).toList());
            export.setMovingAverage7(derivatives.stream().map(SeriesDerivative::getRolling7Avg).toList());
            export.setMovingAverage30(derivatives.stream().map(SeriesDerivative::getRolling30Avg).toList());
        }

        SeriesTrend trend = trend(points);
        if (trend != null) {
            LocalDateTime origin = points.get(0).timestamp();
            export.setTrendValues(points.stream()
                    .map(p -> trend.getSlope() * daysBetween(origin, p.timestamp()) + trend.getIntercept())
                    .toList());
        }
        return export;
    }

    // ---- Series math ----

    static List<SeriesDerivative> derivatives(List<TimeSeriesPoint> points) {
        double[] values = points.stream().mapToDouble(TimeSeriesPoint::value).toArray();
        Double[] growth = new Double[values.length];
        List<SeriesDerivative> result = new ArrayList<>(values.length);

        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                double step = daysBetween(points.get(i - 1).timestamp(), points.get(i).timestamp());
                if (step > 0 && values[i - 1] != 0.0) {
                    growth[i] = (values[i] - values[i - 1]) / values[i - 1] / step;
                }
            }
            Double acceleration = null;
            if (i > 1 && growth[i] != null && growth[i - 1] != null) {
                double step = daysBetween(points.get(i - 1).timestamp(), points.get(i).timestamp());
                acceleration = (growth[i] - growth[i - 1]) / step;
            }
            result.add(SeriesDerivative.builder()
                    .timestamp(points.get(i).timestamp())
                    .value(values[i])
                    .growthRate(growth[i])
                    .acceleration(acceleration)
                    .rolling7Avg(rollingMean(values, i, 7))
                    .rolling30Avg(rollingMean(values, i, 30))
                    .rolling60Avg(rollingMean(values, i, 60))
                    .rolling90Avg(rollingMean(values, i, 90))
                    .rolling7Std(rollingStd(values, i, 7))
                    .rolling30Std(rollingStd(values, i, 30))
                    .build());
        }
        return result;
    }

    static SeriesTrend trend(List<TimeSeriesPoint> points) {
        if (points.size() < MIN_TREND_POINTS) {
            return null;
        }
        LocalDateTime origin = points.get(0).timestamp();
        SimpleRegression regression = new SimpleRegression(true);
        for (TimeSeriesPoint point : points) {
            regression.addData(daysBetween(origin, point.timestamp()), point.value());
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (Double.isNaN(slope)) {
            // All points share one timestamp.
            slope = 0.0;
            intercept = StatUtils.mean(points.stream().mapToDouble(TimeSeriesPoint::value).toArray());
        }
        double rSquared = regression.getTotalSumSquares() == 0.0 ? 1.0 : regression.getRSquare();
        if (Double.isNaN(rSquared)) {
            rSquared = 0.0;
        }

        double lastX = daysBetween(origin, points.get(points.size() - 1).timestamp());
        return SeriesTrend.builder()
                .direction(classify(slope, rSquared))
                .strength(Math.min(Math.abs(rSquared), 1.0))
                .slope(slope)
                .intercept(intercept)
                .rSquared(rSquared)
                .inflectionPoints(inflectionPoints(points))
                .forecast7d(slope * (lastX + 7) + intercept)
                .forecast30d(slope * (lastX + 30) + intercept)
                .build();
    }

    static TrendDirection classify(double slopePerDay, double rSquared) {
        if (rSquared < VOLATILE_R_SQUARED) {
            return TrendDirection.VOLATILE;
        }
        if (Math.abs(slopePerDay) < STABLE_SLOPE_PER_DAY) {
            return TrendDirection.STABLE;
        }
        return slopePerDay > 0 ? TrendDirection.UP : TrendDirection.DOWN;
    }

    static List<LocalDateTime> inflectionPoints(List<TimeSeriesPoint> points) {
        List<LocalDateTime> inflections = new ArrayList<>();
        for (int i = 1; i < points.size() - 1; i++) {
            double before = Math.signum(points.get(i).value() - points.get(i - 1).value());
            double after = Math.signum(points.get(i + 1).value() - points.get(i).value());
            if (before != after) {
                inflections.add(points.get(i).timestamp());
            }
        }
        return inflections;
    }

    private static Double rollingMean(double[] values, int index, int window) {
        int start = Math.max(0, index - window + 1);
        int length = index - start + 1;
        return length < MIN_ROLLING_POINTS ? null : StatUtils.mean(values, start, length);
    }

    private static Double rollingStd(double[] values, int index, int window) {
        int start = Math.max(0, index - window + 1);
        int length = index - start + 1;
        return length < MIN_ROLLING_POINTS ? null : new StandardDeviation(false).evaluate(values, start, length);
    }

    private static double daysBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).getSeconds() / SECONDS_PER_DAY;
    }
}

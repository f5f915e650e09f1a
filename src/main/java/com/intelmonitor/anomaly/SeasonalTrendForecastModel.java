package com.intelmonitor.anomaly;

import com.intelmonitor.domain.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default forecast model: piecewise-linear trend plus additive seasonality.
 *
 * <p>Fitting runs in three steps:
 * <ol>
 *   <li>Trend: ordinary least squares on time (in days). A single hinge changepoint
 *       is tried at every candidate inside the first 80% of the series and kept if it
 *       lowers the residual sum of squares by more than 10%. Past the last observation
 *       the trend continues with the final segment's slope.</li>
 *   <li>Seasonality: mean detrended residual per slot of the seasonal period
 *       (day-of-period by epoch day). Only used once the series covers two full periods.</li>
 *   <li>Noise: sample standard deviation of the remaining residuals, which scales the
 *       interval as {@code yhat ± z(width) · sigma}.</li>
 * </ol>
 */
public class SeasonalTrendForecastModel implements ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(SeasonalTrendForecastModel.class);

    private static final double CHANGEPOINT_RANGE = 0.8;
    private static final double CHANGEPOINT_MIN_GAIN = 0.10;
    private static final double MIN_SIGMA = 1e-9;
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private final int seasonalPeriodDays;

    private LocalDateTime origin;
    private double intercept;
    private double slope;
    private double changepointDays = Double.NaN;
    private double changepointSlopeDelta;
    private double[] seasonal;
    private double sigma;
    private boolean fitted;

    public SeasonalTrendForecastModel(int seasonalPeriodDays) {
        this.seasonalPeriodDays = Math.max(1, seasonalPeriodDays);
    }

    @Override
    public void fit(List<TimeSeriesPoint> points) {
        if (points == null || points.size() < 3) {
            throw new IllegalArgumentException("At least 3 points are required to fit a trend");
        }
        List<TimeSeriesPoint> sorted = points.stream()
                .sorted((a, b) -> a.timestamp().compareTo(b.timestamp()))
                .toList();
        origin = sorted.get(0).timestamp();

        int n = sorted.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = toDays(sorted.get(i).timestamp());
            y[i] = sorted.get(i).value();
        }

        fitTrend(x, y);

        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = y[i] - trendAt(x[i]);
        }

        seasonal = new double[seasonalPeriodDays];
        double span = x[n - 1] - x[0];
        if (seasonalPeriodDays > 1 && span >= 2.0 * seasonalPeriodDays) {
            double[] sums = new double[seasonalPeriodDays];
            int[] counts = new int[seasonalPeriodDays];
            for (int i = 0; i < n; i++) {
                int slot = slot(sorted.get(i).timestamp());
                sums[slot] += residuals[i];
                counts[slot]++;
            }
            for (int s = 0; s < seasonalPeriodDays; s++) {
                seasonal[s] = counts[s] > 0 ? sums[s] / counts[s] : 0.0;
            }
            for (int i = 0; i < n; i++) {
                residuals[i] -= seasonal[slot(sorted.get(i).timestamp())];
            }
        }

        sigma = Math.max(MIN_SIGMA, new StandardDeviation(true).evaluate(residuals));
        fitted = true;
    }

    @Override
    public Forecast predict(LocalDateTime timestamp, double intervalWidth) {
        if (!fitted) {
            throw new IllegalStateException("Model has not been fitted");
        }
        double trend = trendAt(toDays(timestamp));
        double yhat = trend + seasonal[slot(timestamp)];
        double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + intervalWidth / 2.0);
        double halfWidth = z * sigma;
        return new Forecast(timestamp, yhat, yhat - halfWidth, yhat + halfWidth, trend);
    }

    private void fitTrend(double[] x, double[] y) {
        changepointDays = Double.NaN;
        changepointSlopeDelta = 0.0;
        SimpleRegression linear = new SimpleRegression(true);
        for (int i = 0; i < x.length; i++) {
            linear.addData(x[i], y[i]);
        }
        intercept = linear.getIntercept();
        slope = Double.isNaN(linear.getSlope()) ? 0.0 : linear.getSlope();
        if (Double.isNaN(intercept)) {
            intercept = y[0];
        }
        double linearSse = linear.getSumSquaredErrors();

        double bestSse = Double.MAX_VALUE;
        double[] bestBeta = null;
        double bestChangepoint = Double.NaN;
        int lastCandidate = (int) Math.floor(x.length * CHANGEPOINT_RANGE);
        for (int c = 2; c < lastCandidate && c < x.length - 2; c++) {
            double cp = x[c];
            double[][] design = new double[x.length][2];
            for (int i = 0; i < x.length; i++) {
                design[i][0] = x[i];
                design[i][1] = Math.max(0.0, x[i] - cp);
            }
            OLSMultipleLinearRegression hinge = new OLSMultipleLinearRegression();
            try {
                hinge.newSampleData(y, design);
                double sse = hinge.calculateResidualSumOfSquares();
                if (sse < bestSse) {
                    bestSse = sse;
                    bestBeta = hinge.estimateRegressionParameters();
                    bestChangepoint = cp;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Skipping degenerate changepoint candidate at day {}: {}", cp, e.getMessage());
            }
        }

        if (bestBeta != null && bestSse < linearSse * (1.0 - CHANGEPOINT_MIN_GAIN)) {
            intercept = bestBeta[0];
            slope = bestBeta[1];
            changepointDays = bestChangepoint;
            changepointSlopeDelta = bestBeta[2];
        }
    }

    private double trendAt(double days) {
        double value = intercept + slope * days;
        if (!Double.isNaN(changepointDays) && days > changepointDays) {
            value += changepointSlopeDelta * (days - changepointDays);
        }
        return value;
    }

    private double toDays(LocalDateTime timestamp) {
        return Duration.between(origin, timestamp).toMillis() / 86_400_000.0;
    }

    private int slot(LocalDateTime timestamp) {
        return (int) Math.floorMod(timestamp.toLocalDate().toEpochDay(), (long) seasonalPeriodDays);
    }

    public boolean hasChangepoint() {
        return !Double.isNaN(changepointDays);
    }
}

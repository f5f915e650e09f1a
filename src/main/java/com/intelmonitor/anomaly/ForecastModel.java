package com.intelmonitor.anomaly;

import com.intelmonitor.domain.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A fitted time-series model: learn from a numeric series, then forecast any
 * timestamp with a confidence band.
 *
 * <p>Implementations are not thread-safe during {@link #fit}; a fitted model is
 * read-only and may be shared.
 */
public interface ForecastModel {

    /**
     * Fits the model. Callers pass finite values only, at least the configured minimum.
     *
     * @throws IllegalArgumentException if the series cannot be fitted
     */
    void fit(List<TimeSeriesPoint> points);

    /**
     * Forecasts the given timestamp.
     *
     * @param intervalWidth central probability mass of the interval, e.g. 0.80
     */
    Forecast predict(LocalDateTime timestamp, double intervalWidth);
}

package com.intelmonitor.anomaly;

import java.time.LocalDateTime;

/**
 * Model output for one timestamp: point forecast, interval bounds and the trend
 * component alone (without seasonality).
 */
public record Forecast(LocalDateTime timestamp, double yhat, double lower, double upper, double trend) {}

package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.AnomalyType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of the anomaly detector for one metric at one timestamp.
 *
 * <p>Severity runs 0-10 and confidence 0-1. Forecast and bound fields are null for
 * anomaly types that are not derived from a single forecast (volatility spikes).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyScore {

    private String metricName;
    private AnomalyType anomalyType;
    private double severity;
    private double confidence;
    private String explanation;
    private Double forecastValue;
    private Double actualValue;
    private Double lowerBound;
    private Double upperBound;
    private LocalDateTime timestamp;

    /** Supporting numbers such as z_score, deviation_pct, forecast_std, direction. */
    private Map<String, Object> statisticalDetails;
}

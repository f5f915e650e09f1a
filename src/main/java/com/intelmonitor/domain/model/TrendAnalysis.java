package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comparison of the forecast model's trend slope in an older window against a recent one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendAnalysis {

    private String metricName;
    private TrendDirection currentTrend;
    private TrendDirection historicalTrend;
    private double currentSlope;
    private double historicalSlope;
    private double trendStrength;
    private boolean reversalDetected;
    private double reversalConfidence;
}

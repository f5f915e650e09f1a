package com.intelmonitor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-metric rollup statistics. {@code stdDev} is the sample standard deviation
 * and is 0 when fewer than two values are present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricStatistics {

    private double min;
    private double max;
    private double avg;
    private double stdDev;
    private int count;
}

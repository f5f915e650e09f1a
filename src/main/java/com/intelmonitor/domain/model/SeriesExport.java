package com.intelmonitor.domain.model;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chart-ready columns for one metric series. Every list is aligned with {@code timestamps};
 * {@code trendValues} is null when the series is too short for a trend line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesExport {

    private String monitorId;
    private String metricName;
    private List<LocalDateTime> timestamps;
    private List<Double> values;
    private List<Double> growthRates;
    private List<Double> accelerations;
    private List<Double> movingAverage7;
    private List<Double> movingAverage30;
    private List<Double> trendValues;
    private LocalDateTime periodStart;
    private LocalDateTime periodEnd;
    private int dataPoints;
}

package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.AggregationPeriod;
import com.intelmonitor.domain.enums.TrendDirection;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistical rollup over one calendar window of snapshots for one monitor.
 * Window end is exclusive. Derived data: recomputable from snapshots at any time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Aggregation {

    private Long id;
    private String monitorId;
    private AggregationPeriod period;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private int snapshotCount;

    @Builder.Default
    private Map<String, MetricStatistics> metrics = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, TrendDirection> trends = new LinkedHashMap<>();

    /** Keyed "{metric}_ma". */
    @Builder.Default
    private Map<String, Double> movingAverages = new LinkedHashMap<>();

    @Builder.Default
    private List<SignificantChange> significantChanges = new ArrayList<>();

    @Builder.Default
    private List<String> mostCommonTrends = new ArrayList<>();

    private LocalDateTime createdAt;
}

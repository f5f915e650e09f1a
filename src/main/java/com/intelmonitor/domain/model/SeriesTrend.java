package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.TrendDirection;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Least-squares trend of one metric series. The x axis is days since the first point,
 * so {@code slope} is value change per day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesTrend {

    private String monitorId;
    private String metricName;
    private int periodDays;
    private TrendDirection direction;
    private double strength;
    private double slope;
    private double intercept;
    private double rSquared;

    @Builder.Default
    private List<LocalDateTime> inflectionPoints = new ArrayList<>();

    private double forecast7d;
    private double forecast30d;
    private LocalDateTime analyzedAt;
}

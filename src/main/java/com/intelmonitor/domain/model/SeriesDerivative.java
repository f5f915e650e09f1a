package com.intelmonitor.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived values at one point of a metric series. Growth rate and acceleration are per day.
 * Rolling windows count points, not days, and are null until the window holds three points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesDerivative {

    private LocalDateTime timestamp;
    private double value;
    private Double growthRate;
    private Double acceleration;
    private Double rolling7Avg;
    private Double rolling30Avg;
    private Double rolling60Avg;
    private Double rolling90Avg;
    private Double rolling7Std;
    private Double rolling30Std;
}

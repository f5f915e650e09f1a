package com.intelmonitor.anomaly;

import lombok.Builder;
import lombok.Data;

/**
 * Caller-supplied knowledge about the period an observation falls in. Used to damp
 * or amplify severity after detection; the model itself is unaffected.
 */
@Data
@Builder
public class DetectionContext {

    private boolean earningsDay;
    private boolean marketHours;
    private boolean holidayPeriod;
    private boolean marketClosed;

    public static DetectionContext none() {
        return DetectionContext.builder().build();
    }

    public boolean isEmpty() {
        return !earningsDay && !marketHours && !holidayPeriod && !marketClosed;
    }
}

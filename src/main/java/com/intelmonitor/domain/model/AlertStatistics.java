package com.intelmonitor.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Per-monitor dedup and throttle state as seen by the alert scorer.
 */
@Data
@Builder
public class AlertStatistics {

    private String monitorId;
    private int recentAlertCount;
    private int dailyAlertCount;
    private int dailyLimit;
    private int remainingQuota;
    private boolean throttleActive;
}

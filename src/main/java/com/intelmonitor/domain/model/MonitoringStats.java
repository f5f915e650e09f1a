package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.ChangeType;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Dashboard counters for one owner. Alert figures cover the last 24 hours except
 * {@code unreadAlerts}, which counts all unread alerts.
 */
@Data
@Builder
public class MonitoringStats {

    private int totalMonitors;
    private int activeMonitors;
    private int pausedMonitors;
    private int errorMonitors;
    private int totalAlerts24h;
    private int unreadAlerts;
    private double avgAlertConfidence;
    private List<ChangeType> topChangeTypes;
}

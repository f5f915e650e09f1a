package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.MonitorStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A persistent configuration tracking one company for recurring analysis.
 *
 * <p>At most one ACTIVE monitor may exist per (userId, company). Monitors are never
 * physically removed; deletion is a transition to DELETED so that alert and snapshot
 * history stays addressable.
 */
@Data
@Builder(toBuilder = true)
public class Monitor {

    private String id;
    private String userId;
    private String company;
    private String industry;
    private MonitorSettings settings;
    private MonitorStatus status;

    private LocalDateTime createdAt;
    private LocalDateTime lastCheck;
    private LocalDateTime nextCheck;

    private String lastAlertId;
    private int totalAlerts;

    /** Consecutive failed check cycles. Reset on a successful cycle. */
    private int errorCount;

    private String lastError;
}

package com.intelmonitor.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a retention run. In dry-run mode {@code snapshotsAffected} is the number
 * of snapshots that would be deleted and nothing is removed.
 */
@Data
@Builder
public class RetentionResult {

    private LocalDateTime cutoff;
    private int retentionDays;
    private boolean dryRun;
    private long snapshotsAffected;
    private long aggregationsDeleted;
}

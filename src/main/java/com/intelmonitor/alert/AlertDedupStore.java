package com.intelmonitor.alert;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Per-monitor deduplication and throttle window for delivered alerts.
 *
 * <p>This is a best-effort cache, not a source of truth: losing it (restart, eviction)
 * only lets a repeat alert through. Implementations must be safe for concurrent use
 * by the check workers.
 */
public interface AlertDedupStore {

    /** Whether an alert with this content hash was delivered and its window has not expired. */
    boolean isDuplicate(String monitorId, String contentHash, LocalDateTime now);

    /** Alerts delivered for the monitor on the given day. */
    int getDailyCount(String monitorId, LocalDate day);

    /** Whether a medium-tier alert was already delivered in the current batching window. */
    boolean isBatched(String monitorId, LocalDateTime now);

    /** Records a delivered alert: hash window until {@code expiresAt}, plus the daily counter. */
    void recordSent(String monitorId, String contentHash, LocalDateTime expiresAt, LocalDate day, LocalDateTime now);

    void markBatched(String monitorId, LocalDateTime until);

    /** Latest throttle horizon recorded for the monitor, or null. */
    LocalDateTime getThrottleUntil(String monitorId);

    /** Number of unexpired content hashes for the monitor. */
    int getActiveHashCount(String monitorId, LocalDateTime now);

    void clear(String monitorId);
}

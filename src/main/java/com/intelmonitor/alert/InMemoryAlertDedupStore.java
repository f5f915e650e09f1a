package com.intelmonitor.alert;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-instance dedup store. Each monitor's window is guarded by its own lock, so
 * workers checking different monitors never contend.
 */
public class InMemoryAlertDedupStore implements AlertDedupStore {

    private final Map<String, MonitorWindow> windows = new ConcurrentHashMap<>();

    @Override
    public boolean isDuplicate(String monitorId, String contentHash, LocalDateTime now) {
        MonitorWindow window = windows.get(monitorId);
        if (window == null) {
            return false;
        }
        synchronized (window) {
            window.evictExpired(now);
            return window.hashes.containsKey(contentHash);
        }
    }

    @Override
    public int getDailyCount(String monitorId, LocalDate day) {
        MonitorWindow window = windows.get(monitorId);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.dailyCounts.getOrDefault(day, 0);
        }
    }

    @Override
    public boolean isBatched(String monitorId, LocalDateTime now) {
        MonitorWindow window = windows.get(monitorId);
        if (window == null) {
            return false;
        }
        synchronized (window) {
            return window.batchedUntil != null && window.batchedUntil.isAfter(now);
        }
    }

    @Override
    public void recordSent(
            String monitorId, String contentHash, LocalDateTime expiresAt, LocalDate day, LocalDateTime now) {
        MonitorWindow window = windows.computeIfAbsent(monitorId, id -> new MonitorWindow());
        synchronized (window) {
            window.evictExpired(now);
            window.hashes.put(contentHash, expiresAt);
            window.dailyCounts.merge(day, 1, Integer::sum);
            window.dailyCounts.keySet().removeIf(d -> d.isBefore(day));
            if (window.throttleUntil == null || expiresAt.isAfter(window.throttleUntil)) {
                window.throttleUntil = expiresAt;
            }
        }
    }

    @Override
    public void markBatched(String monitorId, LocalDateTime until) {
        MonitorWindow window = windows.computeIfAbsent(monitorId, id -> new MonitorWindow());
        synchronized (window) {
            window.batchedUntil = until;
        }
    }

    @Override
    public LocalDateTime getThrottleUntil(String monitorId) {
        MonitorWindow window = windows.get(monitorId);
        if (window == null) {
            return null;
        }
        synchronized (window) {
            return window.throttleUntil;
        }
    }

    @Override
    public int getActiveHashCount(String monitorId, LocalDateTime now) {
        MonitorWindow window = windows.get(monitorId);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            window.evictExpired(now);
            return window.hashes.size();
        }
    }

    @Override
    public void clear(String monitorId) {
        windows.remove(monitorId);
    }

    private static final class MonitorWindow {

        private final Map<String, LocalDateTime> hashes = new HashMap<>();
        private final Map<LocalDate, Integer> dailyCounts = new HashMap<>();
        private LocalDateTime batchedUntil;
        private LocalDateTime throttleUntil;

        private void evictExpired(LocalDateTime now) {
            hashes.values().removeIf(expiry -> !expiry.isAfter(now));
        }
    }
}

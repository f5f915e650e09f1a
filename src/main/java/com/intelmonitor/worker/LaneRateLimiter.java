package com.intelmonitor.worker;

import com.intelmonitor.config.WorkerConfig;
import com.intelmonitor.domain.enums.TaskType;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Sliding one-minute rate limit per task type. A type without a configured limit is unlimited.
 */
@Component
public class LaneRateLimiter {

    private static final long WINDOW_MILLIS = 60_000L;

    private final WorkerConfig workerConfig;
    private final Clock clock;
    private final Map<TaskType, Deque<Long>> windows = new EnumMap<>(TaskType.class);

    public LaneRateLimiter(WorkerConfig workerConfig, Clock clock) {
        this.workerConfig = workerConfig;
        this.clock = clock;
    }

    /**
     * Takes a permit if one is free.
     *
     * @return 0 when acquired, otherwise milliseconds until the oldest permit in the window expires
     */
    public synchronized long tryAcquire(TaskType taskType) {
        Integer limit = workerConfig.getRateLimitsPerMinute().get(taskType);
        if (limit == null || limit <= 0) {
            return 0L;
        }
        long now = clock.millis();
        Deque<Long> window = windows.computeIfAbsent(taskType, t -> new ArrayDeque<>());
        while (!window.isEmpty() && window.peekFirst() <= now - WINDOW_MILLIS) {
            window.pollFirst();
        }
        if (window.size() < limit) {
            window.addLast(now);
            return 0L;
        }
        return window.peekFirst() + WINDOW_MILLIS - now;
    }

    public synchronized int getUsage(TaskType taskType) {
        Deque<Long> window = windows.get(taskType);
        if (window == null) {
            return 0;
        }
        long now = clock.millis();
        return (int) window.stream().filter(t -> t > now - WINDOW_MILLIS).count();
    }
}

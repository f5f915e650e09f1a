package com.intelmonitor.unit.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.intelmonitor.config.WorkerConfig;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.worker.LaneRateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LaneRateLimiterTest {

    private static final Instant START = Instant.parse("2025-05-06T09:00:00Z");

    private MutableClock clock;
    private WorkerConfig workerConfig;
    private LaneRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        workerConfig = new WorkerConfig();
        rateLimiter = new LaneRateLimiter(workerConfig, clock);
    }

    @Test
    @DisplayName("Ten checks per minute are allowed; the eleventh waits for the oldest permit")
    void monitorCheckLimit() {
        for (int i = 0; i < 10; i++) {
            assertThat(rateLimiter.tryAcquire(TaskType.MONITOR_CHECK)).isZero();
            clock.advance(Duration.ofSeconds(1));
        }

        // oldest permit at t=0 frees at t=60s; now is t=10s
        assertThat(rateLimiter.tryAcquire(TaskType.MONITOR_CHECK)).isEqualTo(50_000L);
        assertThat(rateLimiter.getUsage(TaskType.MONITOR_CHECK)).isEqualTo(10);
    }

    @Test
    @DisplayName("Permits free up as the window slides")
    void windowSlides() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.tryAcquire(TaskType.AGGREGATION);
        }
        assertThat(rateLimiter.tryAcquire(TaskType.AGGREGATION)).isPositive();

        clock.advance(Duration.ofSeconds(60));

        assertThat(rateLimiter.tryAcquire(TaskType.AGGREGATION)).isZero();
        assertThat(rateLimiter.getUsage(TaskType.AGGREGATION)).isEqualTo(1);
    }

    @Test
    @DisplayName("Task types have independent windows")
    void independentTypes() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.tryAcquire(TaskType.MODEL_TRAINING);
        }

        assertThat(rateLimiter.tryAcquire(TaskType.MODEL_TRAINING)).isPositive();
        assertThat(rateLimiter.tryAcquire(TaskType.ALERT_DELIVERY)).isZero();
    }

    @Test
    @DisplayName("A type without a configured limit is unlimited")
    void unlimitedWhenUnconfigured() {
        Map<TaskType, Integer> limits = new EnumMap<>(TaskType.class);
        limits.put(TaskType.MONITOR_CHECK, 1);
        workerConfig.setRateLimitsPerMinute(limits);

        for (int i = 0; i < 100; i++) {
            assertThat(rateLimiter.tryAcquire(TaskType.RETENTION_CLEANUP)).isZero();
        }
        assertThat(rateLimiter.getUsage(TaskType.RETENTION_CLEANUP)).isZero();
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        private void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}

package com.intelmonitor.unit.alert;

import static org.assertj.core.api.Assertions.assertThat;

import com.intelmonitor.alert.InMemoryAlertDedupStore;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryAlertDedupStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 5, 6, 9, 0);
    private static final LocalDate TODAY = NOW.toLocalDate();

    private InMemoryAlertDedupStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertDedupStore();
    }

    @Nested
    @DisplayName("Content Window")
    class ContentWindow {

        @Test
        @DisplayName("Unknown monitor has no duplicates and no throttle")
        void unknownMonitorIsEmpty() {
            assertThat(store.isDuplicate("m1", "hash", NOW)).isFalse();
            assertThat(store.getThrottleUntil("m1")).isNull();
            assertThat(store.getActiveHashCount("m1", NOW)).isZero();
        }

        @Test
        @DisplayName("Recorded hash is a duplicate until its expiry, then evicted")
        void hashExpires() {
            store.recordSent("m1", "hash", NOW.plusHours(4), TODAY, NOW);

            assertThat(store.isDuplicate("m1", "hash", NOW.plusHours(3))).isTrue();
            assertThat(store.isDuplicate("m1", "hash", NOW.plusHours(4))).isFalse();
            assertThat(store.getActiveHashCount("m1", NOW.plusHours(4))).isZero();
        }

        @Test
        @DisplayName("Windows are isolated per monitor")
        void monitorsAreIsolated() {
            store.recordSent("m1", "hash", NOW.plusHours(4), TODAY, NOW);

            assertThat(store.isDuplicate("m2", "hash", NOW)).isFalse();
        }

        @Test
        @DisplayName("Throttle horizon only moves forward")
        void throttleKeepsLatestHorizon() {
            store.recordSent("m1", "a", NOW.plusHours(4), TODAY, NOW);
            store.recordSent("m1", "b", NOW.plusHours(1), TODAY, NOW);

            assertThat(store.getThrottleUntil("m1")).isEqualTo(NOW.plusHours(4));
            assertThat(store.getActiveHashCount("m1", NOW)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Daily Counter And Batching")
    class DailyCounterAndBatching {

        @Test
        @DisplayName("Daily count increments per delivery and is keyed by day")
        void dailyCountPerDay() {
            store.recordSent("m1", "a", NOW.plusHours(4), TODAY, NOW);
            store.recordSent("m1", "b", NOW.plusHours(4), TODAY, NOW);

            assertThat(store.getDailyCount("m1", TODAY)).isEqualTo(2);
            assertThat(store.getDailyCount("m1", TODAY.plusDays(1))).isZero();
        }

        @Test
        @DisplayName("Batched flag holds until its horizon")
        void batchedUntilHorizon() {
            store.markBatched("m1", NOW.plusHours(4));

            assertThat(store.isBatched("m1", NOW.plusHours(2))).isTrue();
            assertThat(store.isBatched("m1", NOW.plusHours(4))).isFalse();
        }

        @Test
        @DisplayName("clear drops hashes, counters, throttle and batching")
        void clearResetsMonitor() {
            store.recordSent("m1", "a", NOW.plusHours(4), TODAY, NOW);
            store.markBatched("m1", NOW.plusHours(4));

            store.clear("m1");

            assertThat(store.isDuplicate("m1", "a", NOW)).isFalse();
            assertThat(store.getDailyCount("m1", TODAY)).isZero();
            assertThat(store.isBatched("m1", NOW)).isFalse();
            assertThat(store.getThrottleUntil("m1")).isNull();
        }
    }
}

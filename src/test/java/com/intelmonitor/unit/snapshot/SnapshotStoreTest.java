package com.intelmonitor.unit.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.intelmonitor.config.SnapshotStoreConfig;
import com.intelmonitor.domain.model.RetentionResult;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.entity.SnapshotEntity;
import com.intelmonitor.exception.StorageException;
import com.intelmonitor.repository.jpa.AggregationJpaRepository;
import com.intelmonitor.repository.jpa.SnapshotJpaRepository;
import com.intelmonitor.snapshot.FieldCompressor;
import com.intelmonitor.snapshot.SnapshotStore;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

/**
 * Unit tests for SnapshotStore covering immediate and batched writes, compression of
 * large sections, range-cache invalidation, trend extraction and retention.
 */
class SnapshotStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    private SnapshotJpaRepository snapshotJpaRepository;
    private AggregationJpaRepository aggregationJpaRepository;
    private SnapshotStoreConfig config;
    private SnapshotStore snapshotStore;

    @BeforeEach
    void setUp() {
        snapshotJpaRepository = mock(SnapshotJpaRepository.class);
        aggregationJpaRepository = mock(AggregationJpaRepository.class);
        config = new SnapshotStoreConfig();
        config.setBatchSize(3);
        config.setCompressionThresholdBytes(256);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

        when(snapshotJpaRepository.save(any(SnapshotEntity.class))).thenAnswer(invocation -> {
            SnapshotEntity entity = invocation.getArgument(0);
            entity.setId(42L);
            return entity;
        });

        snapshotStore = new SnapshotStore(
                snapshotJpaRepository, aggregationJpaRepository, new FieldCompressor(config), config, clock);
    }

    private Snapshot snapshot(String monitorId, LocalDateTime timestamp, double revenue) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("revenue", revenue);
        metrics.put("segment", "cloud");
        return Snapshot.builder()
                .monitorId(monitorId)
                .timestamp(timestamp)
                .company("Acme Corp")
                .industry("Technology")
                .financialMetrics(metrics)
                .marketTrends(new ArrayList<>(List.of("AI adoption")))
                .newsSentiment(0.4)
                .build();
    }

    @Nested
    @DisplayName("Immediate writes")
    class ImmediateWrites {

        @Test
        @DisplayName("put returns the snapshot with the generated id")
        void putAssignsId() {
            Snapshot stored = snapshotStore.put(snapshot("m1", NOW, 1_000_000));

            assertThat(stored.getId()).isEqualTo(42L);
            assertThat(snapshotStore.getStats().getTotalSnapshotsWritten()).isEqualTo(1);
        }

        @Test
        @DisplayName("Repository failure surfaces as StorageException")
        void putWrapsFailure() {
            doThrow(new IllegalStateException("db down")).when(snapshotJpaRepository).save(any(SnapshotEntity.class));

            assertThatThrownBy(() -> snapshotStore.put(snapshot("m1", NOW, 1)))
                    .isInstanceOf(StorageException.class)
                    .hasMessageContaining("m1");
        }

        @Test
        @DisplayName("Large sections are compressed before they reach the repository")
        void largeSectionCompressed() {
            Snapshot big = snapshot("m1", NOW, 1);
            big.getStrategicPosition().put("narrative", "leading position in enterprise software ".repeat(30));

            snapshotStore.put(big);

            ArgumentCaptor<SnapshotEntity> captor = ArgumentCaptor.forClass(SnapshotEntity.class);
            verify(snapshotJpaRepository).save(captor.capture());
            assertThat(captor.getValue().getStrategicPosition()).startsWith(FieldCompressor.MARKER);
            assertThat(captor.getValue().getFinancialMetrics()).doesNotStartWith(FieldCompressor.MARKER);
            assertThat(snapshotStore.getStats().getCompressedFieldsWritten()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Compressed sections are transparently restored on read")
        void compressedRoundTrip() {
            Snapshot big = snapshot("m1", NOW, 1_250_000);
            String narrative = "leading position in enterprise software ".repeat(30);
            big.getStrategicPosition().put("narrative", narrative);
            snapshotStore.put(big);

            ArgumentCaptor<SnapshotEntity> captor = ArgumentCaptor.forClass(SnapshotEntity.class);
            verify(snapshotJpaRepository).save(captor.capture());
            when(snapshotJpaRepository.findRange(eq("m1"), any(), any(), any()))
                    .thenReturn(List.of(captor.getValue()));

            List<Snapshot> range = snapshotStore.getRange("m1", NOW.minusDays(1), NOW.plusDays(1), 0);

            assertThat(range).hasSize(1);
            Snapshot read = range.get(0);
            assertThat(read.getStrategicPosition()).containsEntry("narrative", narrative);
            assertThat(read.getFinancialMetrics()).containsEntry("revenue", 1_250_000.0);
            assertThat(read.getMarketTrends()).containsExactly("AI adoption");
            assertThat(read.getCompetitiveForces()).isEmpty();
        }

        @Test
        @DisplayName("Repeated range query is served from cache until a write for the monitor")
        void rangeCacheInvalidatedOnWrite() {
            when(snapshotJpaRepository.findRange(eq("m1"), any(), any(), any())).thenReturn(List.of());
            LocalDateTime start = NOW.minusDays(7);

            snapshotStore.getRange("m1", start, NOW, 0);
            snapshotStore.getRange("m1", start, NOW, 0);
            verify(snapshotJpaRepository, times(1)).findRange(eq("m1"), any(), any(), any());

            snapshotStore.put(snapshot("m1", NOW, 1));
            snapshotStore.getRange("m1", start, NOW, 0);
            verify(snapshotJpaRepository, times(2)).findRange(eq("m1"), any(), any(), any());
        }

        @Test
        @DisplayName("getNear includes snapshots exactly at either edge of the tolerance")
        void nearIncludesBothEdges() {
            snapshotStore.put(snapshot("m1", NOW.minusHours(2), 100));
            snapshotStore.put(snapshot("m1", NOW.plusHours(2), 200));
            ArgumentCaptor<SnapshotEntity> saved = ArgumentCaptor.forClass(SnapshotEntity.class);
            verify(snapshotJpaRepository, times(2)).save(saved.capture());
            when(snapshotJpaRepository.findWithin(eq("m1"), any(), any(), any())).thenReturn(saved.getAllValues());

            Snapshot near = snapshotStore.getNear("m1", NOW, Duration.ofHours(2));

            assertThat(near.getTimestamp()).isEqualTo(NOW.minusHours(2));
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            verify(snapshotJpaRepository).findWithin(
                    eq("m1"), eq(NOW.minusHours(2)), eq(NOW.plusHours(2)), page.capture());
            assertThat(page.getValue().getPageSize()).isEqualTo(10);
        }

        @Test
        @DisplayName("getNear picks a snapshot sitting exactly on the upper edge")
        void nearUpperEdge() {
            snapshotStore.put(snapshot("m1", NOW.plusHours(1), 300));
            ArgumentCaptor<SnapshotEntity> saved = ArgumentCaptor.forClass(SnapshotEntity.class);
            verify(snapshotJpaRepository).save(saved.capture());
            when(snapshotJpaRepository.findWithin(eq("m1"), eq(NOW.minusHours(1)), eq(NOW.plusHours(1)), any()))
                    .thenReturn(List.of(saved.getValue()));

            Snapshot near = snapshotStore.getNear("m1", NOW, Duration.ofHours(1));

            assertThat(near.getFinancialMetrics()).containsEntry("revenue", 300.0);
            verify(snapshotJpaRepository, never()).findRange(any(), any(), any(), any());
        }

        @Test
        @DisplayName("getNear returns null when nothing falls inside the tolerance")
        void nearNone() {
            when(snapshotJpaRepository.findWithin(eq("m1"), any(), any(), any())).thenReturn(List.of());

            assertThat(snapshotStore.getNear("m1", NOW, Duration.ofMinutes(30))).isNull();
        }

        @Test
        @DisplayName("getLatest returns null for a monitor without snapshots")
        void latestMissing() {
            when(snapshotJpaRepository.findFirstByMonitorIdOrderByTimestampDesc("m1"))
                    .thenReturn(Optional.empty());

            assertThat(snapshotStore.getLatest("m1")).isNull();
        }

        @Test
        @DisplayName("Trend data skips snapshots where the metric is not numeric")
        void trendDataSkipsNonNumeric() {
            Snapshot first = snapshot("m1", NOW.minusDays(2), 100);
            Snapshot second = snapshot("m1", NOW.minusDays(1), 110);
            second.getFinancialMetrics().put("revenue", "n/a");
            snapshotStore.put(first);
            snapshotStore.put(second);
            ArgumentCaptor<SnapshotEntity> captor = ArgumentCaptor.forClass(SnapshotEntity.class);
            verify(snapshotJpaRepository, times(2)).save(captor.capture());
            when(snapshotJpaRepository.findRange(eq("m1"), any(), any(), any())).thenReturn(captor.getAllValues());

            List<TimeSeriesPoint> points = snapshotStore.getTrendData("m1", 30, "revenue");

            assertThat(points).hasSize(1);
            assertThat(points.get(0).value()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("numericValue reads sentiment and rejects non-finite values")
        void numericValueRules() {
            Snapshot s = snapshot("m1", NOW, 5);
            s.getFinancialMetrics().put("margin", Double.NaN);

            assertThat(SnapshotStore.numericValue(s, "revenue")).isEqualTo(5.0);
            assertThat(SnapshotStore.numericValue(s, "news_sentiment")).isEqualTo(0.4);
            assertThat(SnapshotStore.numericValue(s, "margin")).isNull();
            assertThat(SnapshotStore.numericValue(s, "segment")).isNull();
        }
    }

    @Nested
    @DisplayName("Batched writes")
    class BatchedWrites {

        @Test
        @DisplayName("Buffer flushes once the batch size is reached")
        void flushesAtBatchSize() {
            snapshotStore.putBatched(snapshot("m1", NOW, 1));
            snapshotStore.putBatched(snapshot("m2", NOW, 2));
            verify(snapshotJpaRepository, never()).saveAll(anyList());
            assertThat(snapshotStore.getPendingWriteCount()).isEqualTo(2);

            snapshotStore.putBatched(snapshot("m3", NOW, 3));

            verify(snapshotJpaRepository).saveAll(anyList());
            assertThat(snapshotStore.getPendingWriteCount()).isZero();
        }

        @Test
        @DisplayName("A failed flush keeps the batch buffered for the next attempt")
        void failedFlushRequeues() {
            when(snapshotJpaRepository.saveAll(anyList())).thenThrow(new IllegalStateException("db down"));
            snapshotStore.putBatched(snapshot("m1", NOW, 1));

            assertThat(snapshotStore.flushPendingWrites()).isZero();
            assertThat(snapshotStore.getPendingWriteCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Flushing an empty buffer does not touch the repository")
        void emptyFlushNoop() {
            assertThat(snapshotStore.flushPendingWrites()).isZero();
            verify(snapshotJpaRepository, never()).saveAll(anyList());
        }
    }

    @Nested
    @DisplayName("Retention")
    class Retention {

        @Test
        @DisplayName("Dry run counts without deleting")
        void dryRunCountsOnly() {
            when(snapshotJpaRepository.countByTimestampBefore(NOW.minusDays(90))).thenReturn(12L);

            RetentionResult result = snapshotStore.cleanupOldSnapshots(90, true);

            assertThat(result.isDryRun()).isTrue();
            assertThat(result.getSnapshotsAffected()).isEqualTo(12);
            verify(snapshotJpaRepository, never()).deleteAllBefore(any());
            verify(aggregationJpaRepository, never()).deleteEndingBefore(any());
        }

        @Test
        @DisplayName("Live run deletes snapshots and aggregations older than the cutoff")
        void liveRunDeletes() {
            when(snapshotJpaRepository.deleteAllBefore(NOW.minusDays(90))).thenReturn(7);
            when(aggregationJpaRepository.deleteEndingBefore(NOW.minusDays(90))).thenReturn(2);

            RetentionResult result = snapshotStore.cleanupOldSnapshots(90, false);

            assertThat(result.getCutoff()).isEqualTo(NOW.minusDays(90));
            assertThat(result.getSnapshotsAffected()).isEqualTo(7);
            assertThat(result.getAggregationsDeleted()).isEqualTo(2);
        }
    }
}

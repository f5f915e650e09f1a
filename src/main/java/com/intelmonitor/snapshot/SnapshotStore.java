package com.intelmonitor.snapshot;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.intelmonitor.config.SnapshotStoreConfig;
import com.intelmonitor.domain.model.RetentionResult;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.domain.model.SnapshotStoreStats;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import com.intelmonitor.entity.SnapshotEntity;
import com.intelmonitor.exception.StorageException;
import com.intelmonitor.mapper.SnapshotMapper;
import com.intelmonitor.repository.jpa.AggregationJpaRepository;
import com.intelmonitor.repository.jpa.SnapshotJpaRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Durable, append-mostly storage of monitor snapshots with compression, write
 * batching and a short-lived range-query cache.
 *
 * <p>Write paths:
 * <ul>
 *   <li>{@link #put}: immediate single write (check cycles, which need the id back)</li>
 *   <li>{@link #putBatched}: buffered; one {@code saveAll} once the batch size is reached,
 *       on {@link #flushPendingWrites()}, or on the scheduled drain</li>
 * </ul>
 *
 * <p>The range cache is keyed {@code monitorId:start:end:limit} and invalidated per
 * monitor on every write or delete for that monitor. It only absorbs repeated
 * dashboard-style queries; every read path works with the cache empty.
 *
 * <p>Ranges are start-inclusive and end-exclusive, oldest first.
 */
@Service
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    /** Candidates considered by {@link #getNear}. */
    static final int NEAR_CANDIDATE_LIMIT = 10;

    private final SnapshotJpaRepository snapshotJpaRepository;
    private final AggregationJpaRepository aggregationJpaRepository;
    private final FieldCompressor fieldCompressor;
    private final SnapshotStoreConfig snapshotStoreConfig;
    private final Clock clock;
    private final SnapshotMapper snapshotMapper = Mappers.getMapper(SnapshotMapper.class);

    private final Cache<String, List<Snapshot>> rangeCache;

    /** Guarded by itself. */
    private final List<SnapshotEntity> pendingWrites = new ArrayList<>();

    private final AtomicLong totalWritten = new AtomicLong();
    private final AtomicLong compressedFields = new AtomicLong();

    public SnapshotStore(
            SnapshotJpaRepository snapshotJpaRepository,
            AggregationJpaRepository aggregationJpaRepository,
            FieldCompressor fieldCompressor,
            SnapshotStoreConfig snapshotStoreConfig,
            Clock clock) {
        this.snapshotJpaRepository = snapshotJpaRepository;
        this.aggregationJpaRepository = aggregationJpaRepository;
        this.fieldCompressor = fieldCompressor;
        this.snapshotStoreConfig = snapshotStoreConfig;
        this.clock = clock;
        this.rangeCache = Caffeine.newBuilder()
                .expireAfterWrite(snapshotStoreConfig.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(snapshotStoreConfig.getCacheMaxEntries())
                .build();
    }

    // ---- Writes ----

    /**
     * Writes one snapshot immediately and returns it with its generated id.
     *
     * @throws StorageException if the database write fails
     */
    public Snapshot put(Snapshot snapshot) {
        SnapshotEntity entity = encode(snapshot);
        try {
            SnapshotEntity saved = snapshotJpaRepository.save(entity);
            snapshot.setId(saved.getId());
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store snapshot for monitor " + snapshot.getMonitorId(), e);
        }
        totalWritten.incrementAndGet();
        invalidate(snapshot.getMonitorId());
        log.debug("Stored snapshot {} for monitor {}", snapshot.getId(), snapshot.getMonitorId());
        return snapshot;
    }

    /**
     * Buffers a snapshot for a batched write. Flushes when the buffer reaches the
     * configured batch size.
     */
    public void putBatched(Snapshot snapshot) {
        boolean full;
        synchronized (pendingWrites) {
            pendingWrites.add(encode(snapshot));
            full = pendingWrites.size() >= snapshotStoreConfig.getBatchSize();
        }
        if (full) {
            flushPendingWrites();
        }
    }

    /**
     * Writes all buffered snapshots in one batch. A failed batch is put back into
     * the buffer for the next flush.
     *
     * @return number of snapshots written
     */
    public int flushPendingWrites() {
        List<SnapshotEntity> batch;
        synchronized (pendingWrites) {
            if (pendingWrites.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(pendingWrites);
            pendingWrites.clear();
        }

        try {
            snapshotJpaRepository.saveAll(batch);
        } catch (RuntimeException e) {
            log.error("Failed to flush {} buffered snapshots: {}", batch.size(), e.getMessage());
            synchronized (pendingWrites) {
                pendingWrites.addAll(0, batch);
            }
            return 0;
        }

        totalWritten.addAndGet(batch.size());
        Set<String> touched = new HashSet<>();
        batch.forEach(entity -> touched.add(entity.getMonitorId()));
        touched.forEach(this::invalidate);
        log.debug("Flushed {} buffered snapshots across {} monitors", batch.size(), touched.size());
        return batch.size();
    }

    @Scheduled(fixedDelayString = "${intelmonitor.snapshot-store.flush-interval-ms:30000}")
    public void scheduledFlush() {
        flushPendingWrites();
    }

    // ---- Reads ----

    /**
     * Returns snapshots in [start, end) for a monitor, oldest first.
     *
     * @param limit maximum rows; 0 or negative means unlimited
     */
    public List<Snapshot> getRange(String monitorId, LocalDateTime start, LocalDateTime end, int limit) {
        String cacheKey = monitorId + ":" + start + ":" + end + ":" + limit;
        List<Snapshot> cached = rangeCache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached;
        }

        Pageable pageable = limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        List<Snapshot> snapshots = snapshotJpaRepository.findRange(monitorId, start, end, pageable).stream()
                .map(this::decode)
                .toList();
        rangeCache.put(cacheKey, snapshots);
        return snapshots;
    }

    /** Most recent snapshot for a monitor, or null when none exists. */
    public Snapshot getLatest(String monitorId) {
        return snapshotJpaRepository
                .findFirstByMonitorIdOrderByTimestampDesc(monitorId)
                .map(this::decode)
                .orElse(null);
    }

    /**
     * Snapshot closest to {@code target} within [target - tolerance, target + tolerance],
     * or null when none qualifies. Only the first {@value #NEAR_CANDIDATE_LIMIT} snapshots of
     * the window are considered. Ties go to the earlier snapshot.
     */
    public Snapshot getNear(String monitorId, LocalDateTime target, Duration tolerance) {
        List<SnapshotEntity> candidates = snapshotJpaRepository.findWithin(
                monitorId, target.minus(tolerance), target.plus(tolerance), PageRequest.of(0, NEAR_CANDIDATE_LIMIT));
        Optional<Snapshot> closest = candidates.stream()
                .map(this::decode)
                .min(Comparator.comparingLong(s -> Math.abs(Duration.between(target, s.getTimestamp()).toMillis())));
        return closest.orElse(null);
    }

    /**
     * Numeric series for one metric over the last {@code days} days. Snapshots where
     * the metric is missing or non-numeric are skipped. The pseudo-metric
     * {@code news_sentiment} reads the sentiment score.
     */
    public List<TimeSeriesPoint> getTrendData(String monitorId, int days, String metric) {
        LocalDateTime end = LocalDateTime.now(clock);
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (Snapshot snapshot : getRange(monitorId, end.minusDays(days), end.plusSeconds(1), 0)) {
            Double value = numericValue(snapshot, metric);
            if (value != null) {
                points.add(new TimeSeriesPoint(snapshot.getTimestamp(), value));
            }
        }
        return points;
    }

    // ---- Deletes ----

    /** Deletes a monitor's snapshots older than the cutoff. */
    public int deleteBefore(String monitorId, LocalDateTime cutoff) {
        int deleted = snapshotJpaRepository.deleteByMonitorIdBefore(monitorId, cutoff);
        invalidate(monitorId);
        log.info("Deleted {} snapshots for monitor {} older than {}", deleted, monitorId, cutoff);
        return deleted;
    }

    /**
     * Applies the retention policy across all monitors, regardless of monitor status.
     * A live run also removes aggregations whose window ended before the cutoff.
     */
    public RetentionResult cleanupOldSnapshots(int retentionDays, boolean dryRun) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);

        if (dryRun) {
            long wouldDelete = snapshotJpaRepository.countByTimestampBefore(cutoff);
            log.info("Retention dry run: {} snapshots older than {} would be deleted", wouldDelete, cutoff);
            return RetentionResult.builder()
                    .cutoff(cutoff)
                    .retentionDays(retentionDays)
                    .dryRun(true)
                    .snapshotsAffected(wouldDelete)
                    .build();
        }

        int deletedSnapshots = snapshotJpaRepository.deleteAllBefore(cutoff);
        int deletedAggregations = aggregationJpaRepository.deleteEndingBefore(cutoff);
        rangeCache.invalidateAll();
        log.info(
                "Retention cleanup: deleted {} snapshots and {} aggregations older than {}",
                deletedSnapshots,
                deletedAggregations,
                cutoff);
        return RetentionResult.builder()
                .cutoff(cutoff)
                .retentionDays(retentionDays)
                .dryRun(false)
                .snapshotsAffected(deletedSnapshots)
                .aggregationsDeleted(deletedAggregations)
                .build();
    }

    // ---- Cache / stats ----

    public void clearCache() {
        rangeCache.invalidateAll();
    }

    private void invalidate(String monitorId) {
        String prefix = monitorId + ":";
        List<String> keys = rangeCache.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList();
        rangeCache.invalidateAll(keys);
    }

    public int getPendingWriteCount() {
        synchronized (pendingWrites) {
            return pendingWrites.size();
        }
    }

    public SnapshotStoreStats getStats() {
        return SnapshotStoreStats.builder()
                .pendingWrites(getPendingWriteCount())
                .cachedQueries(rangeCache.estimatedSize())
                .batchSize(snapshotStoreConfig.getBatchSize())
                .compressionThresholdBytes(snapshotStoreConfig.getCompressionThresholdBytes())
                .cacheTtlSeconds(snapshotStoreConfig.getCacheTtlSeconds())
                .totalSnapshotsWritten(totalWritten.get())
                .compressedFieldsWritten(compressedFields.get())
                .build();
    }

    // ---- Encoding ----

    private SnapshotEntity encode(Snapshot snapshot) {
        SnapshotEntity entity = snapshotMapper.toEntity(snapshot);
        entity.setFinancialMetrics(compress(entity.getFinancialMetrics()));
        entity.setCompetitiveForces(compress(entity.getCompetitiveForces()));
        entity.setStrategicPosition(compress(entity.getStrategicPosition()));
        return entity;
    }

    private String compress(String json) {
        String stored = fieldCompressor.compressIfLarge(json);
        if (fieldCompressor.isCompressed(stored)) {
            compressedFields.incrementAndGet();
        }
        return stored;
    }

    private Snapshot decode(SnapshotEntity entity) {
        // Detached copy: managed entities must not see decompressed values.
        SnapshotEntity plain = SnapshotEntity.builder()
                .id(entity.getId())
                .monitorId(entity.getMonitorId())
                .timestamp(entity.getTimestamp())
                .company(entity.getCompany())
                .industry(entity.getIndustry())
                .financialMetrics(fieldCompressor.decompress(entity.getFinancialMetrics()))
                .marketTrends(entity.getMarketTrends())
                .competitiveForces(fieldCompressor.decompress(entity.getCompetitiveForces()))
                .strategicPosition(fieldCompressor.decompress(entity.getStrategicPosition()))
                .newsSentiment(entity.getNewsSentiment())
                .competitorMentions(entity.getCompetitorMentions())
                .build();
        return snapshotMapper.toDomain(plain);
    }

    /** Reads a metric as a finite double, or null. */
    public static Double numericValue(Snapshot snapshot, String metric) {
        Object raw = "news_sentiment".equals(metric)
                ? snapshot.getNewsSentiment()
                : snapshot.getFinancialMetrics() != null
                        ? snapshot.getFinancialMetrics().get(metric)
                        : null;
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        return null;
    }
}

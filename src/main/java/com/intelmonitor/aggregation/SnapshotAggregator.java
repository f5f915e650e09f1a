package com.intelmonitor.aggregation;

import com.intelmonitor.domain.enums.AggregationPeriod;
import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.domain.enums.TrendDirection;
import com.intelmonitor.domain.model.Aggregation;
import com.intelmonitor.domain.model.MetricStatistics;
import com.intelmonitor.domain.model.SignificantChange;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.entity.AggregationEntity;
import com.intelmonitor.entity.MonitorEntity;
import com.intelmonitor.mapper.AggregationMapper;
import com.intelmonitor.repository.jpa.AggregationJpaRepository;
import com.intelmonitor.repository.jpa.MonitorJpaRepository;
import com.intelmonitor.snapshot.SnapshotStore;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rolls snapshots up into daily, weekly and monthly aggregations.
 *
 * <p>Per numeric metric (financial metrics plus {@code news_sentiment}) an aggregation carries
 * min/max/avg/sample std/count, a direction from the least-squares slope over the sample index,
 * and a {@code {metric}_ma} window mean. Consecutive jumps above 20% are listed as significant
 * changes, largest first, at most 10. Market trends are ranked by frequency, top 5.
 *
 * <p>Output depends only on the snapshots in the window, so regenerating a window is idempotent.
 * Failures never propagate: they are logged and reported as "no aggregation" (null).
 */
@Service
public class SnapshotAggregator {

    private static final Logger log = LoggerFactory.getLogger(SnapshotAggregator.class);

    static final String SENTIMENT_METRIC = "news_sentiment";
    private static final double SIGNIFICANT_CHANGE_PCT = 20.0;
    private static final int MAX_SIGNIFICANT_CHANGES = 10;
    private static final int MAX_COMMON_TRENDS = 5;
    private static final double STABLE_FRACTION = 0.05;
    private static final double STABLE_FLOOR = 0.01;

    private final SnapshotStore snapshotStore;
    private final AggregationJpaRepository aggregationJpaRepository;
    private final MonitorJpaRepository monitorJpaRepository;
    private final Clock clock;
    private final AggregationMapper aggregationMapper = Mappers.getMapper(AggregationMapper.class);

    public SnapshotAggregator(
            SnapshotStore snapshotStore,
            AggregationJpaRepository aggregationJpaRepository,
            MonitorJpaRepository monitorJpaRepository,
            Clock clock) {
        this.snapshotStore = snapshotStore;
        this.aggregationJpaRepository = aggregationJpaRepository;
        this.monitorJpaRepository = monitorJpaRepository;
        this.clock = clock;
    }

    public Aggregation generateDaily(String monitorId, LocalDate date) {
        return generate(monitorId, AggregationWindow.daily(date));
    }

    public Aggregation generateWeekly(String monitorId, LocalDate dayInWeek) {
        return generate(monitorId, AggregationWindow.weekly(dayInWeek));
    }

    public Aggregation generateMonthly(String monitorId, int year, int month) {
        return generate(monitorId, AggregationWindow.monthly(year, month));
    }

    /**
     * Builds and stores the aggregation for one window, replacing any stored version.
     * Returns null when the window has no snapshots or generation failed.
     */
    public Aggregation generate(String monitorId, AggregationWindow window) {
        try {
            List<Snapshot> snapshots = snapshotStore.getRange(monitorId, window.start(), window.end(), 0);
            if (snapshots.isEmpty()) {
                log.debug("No snapshots for monitor {} in {} window {}", monitorId, window.period(), window.start());
                return null;
            }
            Aggregation aggregation = aggregate(monitorId, window, snapshots);
            return store(aggregation);
        } catch (RuntimeException e) {
            log.warn(
                    "Aggregation failed for monitor {} ({} {}): {}",
                    monitorId,
                    window.period(),
                    window.start(),
                    e.getMessage());
            return null;
        }
    }

    /**
     * Returns the stored aggregation for the window containing {@code date}, generating
     * and storing it on a miss.
     */
    public Aggregation get(String monitorId, AggregationPeriod period, LocalDate date) {
        AggregationWindow window = AggregationWindow.of(period, date);
        try {
            Optional<AggregationEntity> stored =
                    aggregationJpaRepository.findByMonitorIdAndPeriodAndStartTime(monitorId, period, window.start());
            if (stored.isPresent()) {
                return aggregationMapper.toDomain(stored.get());
            }
        } catch (RuntimeException e) {
            log.warn("Could not read stored aggregation for monitor {}: {}", monitorId, e.getMessage());
            return null;
        }
        return generate(monitorId, window);
    }

    /**
     * Regenerates every window of the requested periods overlapping [startDate, endDate].
     *
     * @return number of aggregations produced per period
     */
    public Map<AggregationPeriod, Integer> backfill(
            String monitorId, LocalDate startDate, LocalDate endDate, List<AggregationPeriod> periods) {
        Map<AggregationPeriod, Integer> counts = new EnumMap<>(AggregationPeriod.class);
        LocalDateTime limit = endDate.plusDays(1).atStartOfDay();
        for (AggregationPeriod period : periods) {
            int produced = 0;
            for (AggregationWindow window = AggregationWindow.of(period, startDate);
                    window.start().isBefore(limit);
                    window = window.next()) {
                if (generate(monitorId, window) != null) {
                    produced++;
                }
            }
            counts.put(period, produced);
        }
        log.info("Backfill for monitor {} from {} to {}: {}", monitorId, startDate, endDate, counts);
        return counts;
    }

    /**
     * Nightly job: daily rollup of yesterday for every active monitor.
     *
     * @return number of aggregations produced
     */
    public int runDailyAggregation() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        List<MonitorEntity> active = monitorJpaRepository.findByStatus(MonitorStatus.ACTIVE);
        int produced = 0;
        for (MonitorEntity monitor : active) {
            if (generateDaily(monitor.getId(), yesterday) != null) {
                produced++;
            }
        }
        log.info("Daily aggregation for {}: {}/{} monitors aggregated", yesterday, produced, active.size());
        return produced;
    }

    /** Pure computation over the given snapshots; nothing is stored. */
    public Aggregation aggregate(String monitorId, AggregationWindow window, List<Snapshot> snapshots) {
        List<Snapshot> ordered = snapshots.stream()
                .filter(s -> window.contains(s.getTimestamp()))
                .sorted(Comparator.comparing(Snapshot::getTimestamp))
                .toList();

        Map<String, double[]> series = numericSeries(ordered);
        Map<String, MetricStatistics> metrics = new LinkedHashMap<>();
        Map<String, TrendDirection> trends = new LinkedHashMap<>();
        Map<String, Double> movingAverages = new LinkedHashMap<>();
        List<SignificantChange> significantChanges = new ArrayList<>();

        for (Map.Entry<String, double[]> entry : series.entrySet()) {
            String metric = entry.getKey();
            double[] values = entry.getValue();
            double mean = StatUtils.mean(values);
            metrics.put(
                    metric,
                    new MetricStatistics(
                            StatUtils.min(values),
                            StatUtils.max(values),
                            mean,
                            values.length < 2 ? 0.0 : new StandardDeviation(true).evaluate(values),
                            values.length));
            trends.put(metric, trendDirection(values, mean));
            movingAverages.put(metric + "_ma", mean);
            significantChanges.addAll(significantChanges(metric, values));
        }

        significantChanges.sort(Comparator.comparingDouble((SignificantChange c) -> Math.abs(c.getChangePct()))
                .reversed());
        List<SignificantChange> topChanges = new ArrayList<>(
                significantChanges.subList(0, Math.min(MAX_SIGNIFICANT_CHANGES, significantChanges.size())));

        return Aggregation.builder()
                .monitorId(monitorId)
                .period(window.period())
                .startTime(window.start())
                .endTime(window.end())
                .snapshotCount(ordered.size())
                .metrics(metrics)
                .trends(trends)
                .movingAverages(movingAverages)
                .significantChanges(topChanges)
                .mostCommonTrends(mostCommonTrends(ordered))
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private Aggregation store(Aggregation aggregation) {
        AggregationEntity entity = aggregationMapper.toEntity(aggregation);
        aggregationJpaRepository
                .findByMonitorIdAndPeriodAndStartTime(
                        aggregation.getMonitorId(), aggregation.getPeriod(), aggregation.getStartTime())
                .ifPresent(existing -> entity.setId(existing.getId()));
        return aggregationMapper.toDomain(aggregationJpaRepository.save(entity));
    }

    /** Metric name to values in timestamp order, metrics in name order. */
    private static Map<String, double[]> numericSeries(List<Snapshot> snapshots) {
        TreeSet<String> names = new TreeSet<>();
        for (Snapshot snapshot : snapshots) {
            if (snapshot.getFinancialMetrics() != null) {
                names.addAll(snapshot.getFinancialMetrics().keySet());
            }
        }
        names.add(SENTIMENT_METRIC);

        Map<String, double[]> series = new LinkedHashMap<>();
        for (String name : names) {
            double[] values = snapshots.stream()
                    .map(s -> SnapshotStore.numericValue(s, name))
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            if (values.length > 0) {
                series.put(name, values);
            }
        }
        return series;
    }

    public static TrendDirection trendDirection(double[] values, double mean) {
        if (values.length < 2) {
            return TrendDirection.STABLE;
        }
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        if (Double.isNaN(slope)) {
            return TrendDirection.STABLE;
        }
        double threshold = mean == 0.0 ? STABLE_FLOOR : Math.abs(mean * STABLE_FRACTION);
        if (slope > threshold) {
            return TrendDirection.UP;
        }
        if (slope < -threshold) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.STABLE;
    }

    private static List<SignificantChange> significantChanges(String metric, double[] values) {
        List<SignificantChange> changes = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            if (previous == 0.0) {
                continue;
            }
            double changePct = (values[i] - previous) / Math.abs(previous) * 100.0;
            if (Math.abs(changePct) > SIGNIFICANT_CHANGE_PCT) {
                changes.add(new SignificantChange(
                        metric, Math.round(changePct * 10.0) / 10.0, previous, values[i], i));
            }
        }
        return changes;
    }

    private static List<String> mostCommonTrends(List<Snapshot> snapshots) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Snapshot snapshot : snapshots) {
            if (snapshot.getMarketTrends() != null) {
                for (String trend : snapshot.getMarketTrends()) {
                    counts.merge(trend, 1, Integer::sum);
                }
            }
        }
        // stable sort keeps first-seen order among equal counts
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_COMMON_TRENDS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}

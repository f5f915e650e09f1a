package com.intelmonitor.change;

import com.intelmonitor.domain.enums.ChangeType;
import com.intelmonitor.domain.model.Change;
import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.mapper.JsonHelper;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Diffs two snapshots into typed, confidence-scored changes.
 *
 * <p>Three buckets are compared independently:
 * <ul>
 *   <li>Free-text sections (competitive forces, strategic position): a mismatch of the
 *       normalized content hash for the same key, both sides non-empty. Confidence 0.8.</li>
 *   <li>Market trends: set difference. New trends 0.75, disappeared trends 0.70.</li>
 *   <li>Numeric metrics: relative change above 10%. Confidence 0.9. Skipped when either
 *       side is non-numeric or the previous value is zero.</li>
 * </ul>
 *
 * <p>Keys are visited in sorted order so the output does not depend on map iteration order.
 */
@Component
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    public static final double TEXT_CHANGE_CONFIDENCE = 0.8;
    public static final double NEW_TREND_CONFIDENCE = 0.75;
    public static final double DECLINED_TREND_CONFIDENCE = 0.70;
    public static final double METRIC_CHANGE_CONFIDENCE = 0.9;

    private static final double METRIC_CHANGE_THRESHOLD_PCT = 10.0;
    private static final int MAX_VALUE_LENGTH = 200;
    private static final int MAX_LISTED_TRENDS = 3;

    private final Clock clock;

    public ChangeDetector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the changes from {@code previous} to {@code current}; empty when there is
     * no previous snapshot (no baseline yet).
     */
    public List<Change> detect(Snapshot previous, Snapshot current) {
        if (previous == null || current == null) {
            return new ArrayList<>();
        }
        LocalDateTime now = LocalDateTime.now(clock);

        List<Change> changes = new ArrayList<>();
        changes.addAll(detectTextChanges(previous.getCompetitiveForces(), current.getCompetitiveForces(), now));
        changes.addAll(detectStrategicChanges(previous.getStrategicPosition(), current.getStrategicPosition(), now));
        changes.addAll(detectTrendChanges(previous.getMarketTrends(), current.getMarketTrends(), now));
        changes.addAll(detectMetricChanges(previous.getFinancialMetrics(), current.getFinancialMetrics(), now));

        log.debug("Detected {} changes for monitor {}", changes.size(), current.getMonitorId());
        return changes;
    }

    private List<Change> detectTextChanges(Map<String, String> previous, Map<String, String> current, LocalDateTime now) {
        List<Change> changes = new ArrayList<>();
        if (previous == null || current == null) {
            return changes;
        }
        for (String key : new TreeSet<>(current.keySet())) {
            String before = previous.get(key);
            String after = current.get(key);
            if (isBlank(before) || isBlank(after)) {
                continue;
            }
            if (!ContentHash.ofNormalized(before).equals(ContentHash.ofNormalized(after))) {
                changes.add(Change.builder()
                        .changeType(ChangeType.COMPETITIVE_LANDSCAPE)
                        .title("Change in " + titleCase(key))
                        .description("Competitive force '" + key + "' has changed")
                        .confidence(TEXT_CHANGE_CONFIDENCE)
                        .detectedAt(now)
                        .previousValue(truncate(before))
                        .currentValue(truncate(after))
                        .sourceUrls(List.of())
                        .build());
            }
        }
        return changes;
    }

    private List<Change> detectStrategicChanges(
            Map<String, Object> previous, Map<String, Object> current, LocalDateTime now) {
        List<Change> changes = new ArrayList<>();
        if (previous == null || current == null) {
            return changes;
        }
        for (String key : new TreeSet<>(current.keySet())) {
            String before = asText(previous.get(key));
            String after = asText(current.get(key));
            if (isBlank(before) || isBlank(after)) {
                continue;
            }
            if (!ContentHash.ofNormalized(before).equals(ContentHash.ofNormalized(after))) {
                changes.add(Change.builder()
                        .changeType(ChangeType.STRATEGIC_SHIFT)
                        .title("Strategic Shift in " + titleCase(key))
                        .description("Strategic position '" + key + "' has changed")
                        .confidence(TEXT_CHANGE_CONFIDENCE)
                        .detectedAt(now)
                        .previousValue(truncate(before))
                        .currentValue(truncate(after))
                        .sourceUrls(List.of())
                        .build());
            }
        }
        return changes;
    }

    private List<Change> detectTrendChanges(List<String> previous, List<String> current, LocalDateTime now) {
        List<Change> changes = new ArrayList<>();
        Set<String> before = previous == null ? Set.of() : new LinkedHashSet<>(previous);
        Set<String> after = current == null ? Set.of() : new LinkedHashSet<>(current);

        List<String> added = after.stream().filter(t -> !before.contains(t)).sorted().toList();
        List<String> removed = before.stream().filter(t -> !after.contains(t)).sorted().toList();

        if (!added.isEmpty()) {
            changes.add(Change.builder()
                    .changeType(ChangeType.MARKET_TREND)
                    .title("New Market Trends Detected")
                    .description("New trends: " + String.join(", ", head(added)))
                    .confidence(NEW_TREND_CONFIDENCE)
                    .detectedAt(now)
                    .currentValue(String.join(", ", added))
                    .sourceUrls(List.of())
                    .build());
        }
        if (!removed.isEmpty()) {
            changes.add(Change.builder()
                    .changeType(ChangeType.MARKET_TREND)
                    .title("Market Trends No Longer Detected")
                    .description("Trends declined: " + String.join(", ", head(removed)))
                    .confidence(DECLINED_TREND_CONFIDENCE)
                    .detectedAt(now)
                    .previousValue(String.join(", ", removed))
                    .sourceUrls(List.of())
                    .build());
        }
        return changes;
    }

    private List<Change> detectMetricChanges(
            Map<String, Object> previous, Map<String, Object> current, LocalDateTime now) {
        List<Change> changes = new ArrayList<>();
        if (previous == null || current == null) {
            return changes;
        }
        for (String metric : new TreeSet<>(current.keySet())) {
            if (!(previous.get(metric) instanceof Number before) || !(current.get(metric) instanceof Number after)) {
                continue;
            }
            double prev = before.doubleValue();
            double curr = after.doubleValue();
            if (prev == 0.0 || !Double.isFinite(prev) || !Double.isFinite(curr)) {
                continue;
            }
            double changePct = (curr - prev) / Math.abs(prev) * 100.0;
            if (Math.abs(changePct) > METRIC_CHANGE_THRESHOLD_PCT) {
                changes.add(Change.builder()
                        .changeType(ChangeType.FINANCIAL_METRIC)
                        .title("Significant Change in " + metric)
                        .description(String.format(Locale.ROOT, "%s changed by %.1f%%", metric, changePct))
                        .confidence(METRIC_CHANGE_CONFIDENCE)
                        .detectedAt(now)
                        .previousValue(String.valueOf(before))
                        .currentValue(String.valueOf(after))
                        .sourceUrls(List.of())
                        .build());
            }
        }
        return changes;
    }

    private static List<String> head(List<String> items) {
        return items.subList(0, Math.min(MAX_LISTED_TRENDS, items.size()));
    }

    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        return JsonHelper.toCanonicalJson(value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String truncate(String value) {
        return value.length() > MAX_VALUE_LENGTH ? value.substring(0, MAX_VALUE_LENGTH) : value;
    }

    static String titleCase(String key) {
        StringBuilder result = new StringBuilder();
        for (String word : key.replace('_', ' ').trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase());
        }
        return result.toString();
    }
}

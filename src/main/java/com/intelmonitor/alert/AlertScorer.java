package com.intelmonitor.alert;

import com.intelmonitor.change.ContentHash;
import com.intelmonitor.config.AlertScoringConfig;
import com.intelmonitor.domain.enums.ChangeType;
import com.intelmonitor.domain.enums.UrgencyLevel;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.AlertPriority;
import com.intelmonitor.domain.model.AlertStatistics;
import com.intelmonitor.domain.model.AnomalyScore;
import com.intelmonitor.domain.model.Change;
import com.intelmonitor.domain.model.MonitorSettings;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores alerts 0-10, maps the score to an urgency tier, and decides delivery.
 *
 * <p>Score components, summed then capped at 10:
 * <ul>
 *   <li>Severity: average anomaly severity x 0.4, or change confidence x 4 when there are no anomalies</li>
 *   <li>Volume: 0.5 per change, at most 3</li>
 *   <li>Critical categories (financial, competitive, regulatory): +2</li>
 *   <li>User-preferred categories: 0.5 per matching change, at most 1</li>
 * </ul>
 * A confidence below the monitor's threshold halves the total.
 *
 * <p>Delivery ({@link #shouldSend}) checks, in order: identical content already delivered inside
 * its throttle window, the per-day cap, the tier's notify flag. Only delivered alerts are recorded
 * into the dedup window.
 */
@Service
public class AlertScorer {

    private static final Logger log = LoggerFactory.getLogger(AlertScorer.class);

    private static final double ANOMALY_SEVERITY_WEIGHT = 0.4;
    private static final double CONFIDENCE_WEIGHT = 4.0;
    private static final double PER_CHANGE_SCORE = 0.5;
    private static final double MAX_VOLUME_SCORE = 3.0;
    private static final double CRITICAL_TYPE_BONUS = 2.0;
    private static final double PER_PREFERENCE_SCORE = 0.5;
    private static final double MAX_PREFERENCE_SCORE = 1.0;
    private static final double MAX_SCORE = 10.0;

    static final Set<ChangeType> CRITICAL_TYPES =
            EnumSet.of(ChangeType.FINANCIAL_METRIC, ChangeType.COMPETITIVE_LANDSCAPE, ChangeType.REGULATORY);

    private final AlertDedupStore alertDedupStore;
    private final AlertScoringConfig alertScoringConfig;
    private final Clock clock;

    private final Map<String, AtomicInteger> feedbackCounts = new ConcurrentHashMap<>();

    public AlertScorer(AlertDedupStore alertDedupStore, AlertScoringConfig alertScoringConfig, Clock clock) {
        this.alertDedupStore = alertDedupStore;
        this.alertScoringConfig = alertScoringConfig;
        this.clock = clock;
    }

    /**
     * Scores an alert against the monitor's settings. Anomalies are read from the alert itself.
     */
    public AlertPriority score(Alert alert, MonitorSettings settings) {
        List<Change> changes = alert.getChanges() != null ? alert.getChanges() : List.of();
        List<AnomalyScore> anomalies = alert.getAnomalyScores() != null ? alert.getAnomalyScores() : List.of();
        List<String> reasoning = new ArrayList<>();
        double score = 0.0;

        if (!anomalies.isEmpty()) {
            double avgSeverity = anomalies.stream()
                    .mapToDouble(AnomalyScore::getSeverity)
                    .average()
                    .orElse(0.0);
            score += avgSeverity * ANOMALY_SEVERITY_WEIGHT;
            reasoning.add(String.format(
                    Locale.ROOT, "Statistical anomaly severity %.1f/10 across %d metrics", avgSeverity, anomalies.size()));
        } else {
            score += alert.getConfidence() * CONFIDENCE_WEIGHT;
            reasoning.add(String.format(Locale.ROOT, "Change confidence %.2f", alert.getConfidence()));
        }

        if (!changes.isEmpty()) {
            score += Math.min(MAX_VOLUME_SCORE, changes.size() * PER_CHANGE_SCORE);
            long categories = changes.stream().map(Change::getChangeType).distinct().count();
            reasoning.add(changes.size() + " changes across " + categories + " categories");
        }

        Set<ChangeType> critical = changes.stream()
                .map(Change::getChangeType)
                .filter(CRITICAL_TYPES::contains)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ChangeType.class)));
        if (!critical.isEmpty()) {
            score += CRITICAL_TYPE_BONUS;
            reasoning.add("Critical change categories: " + critical);
        }

        List<ChangeType> preferred = settings != null && settings.getPreferredChangeTypes() != null
                ? settings.getPreferredChangeTypes()
                : List.of();
        if (!preferred.isEmpty()) {
            long matches = changes.stream()
                    .filter(c -> preferred.contains(c.getChangeType()))
                    .count();
            if (matches > 0) {
                score += Math.min(MAX_PREFERENCE_SCORE, matches * PER_PREFERENCE_SCORE);
                reasoning.add(matches + " changes match preferred categories");
            }
        }

        double threshold = settings != null ? settings.getAlertThreshold() : 0.0;
        if (alert.getConfidence() < threshold) {
            score *= 0.5;
            reasoning.add(String.format(
                    Locale.ROOT, "Confidence %.2f below threshold %.2f", alert.getConfidence(), threshold));
        }

        score = Math.min(MAX_SCORE, score);
        UrgencyLevel urgency = UrgencyLevel.fromScore(score);
        LocalDateTime now = LocalDateTime.now(clock);

        return AlertPriority.builder()
                .score(score)
                .urgencyLevel(urgency)
                .shouldNotify(tierNotifies(urgency, alert.getMonitorId(), now))
                .reasoning(reasoning)
                .throttleUntil(now.plusHours(urgency.getThrottleHours()))
                .build();
    }

    /**
     * Decides whether the alert is delivered, recording it into the dedup window when it is.
     */
    public boolean shouldSend(Alert alert, AlertPriority priority) {
        String monitorId = alert.getMonitorId();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        String hash = contentHash(alert);

        if (alertDedupStore.isDuplicate(monitorId, hash, now)) {
            log.info("Suppressing duplicate alert for monitor {} (hash {})", monitorId, hash);
            return false;
        }

        int sentToday = alertDedupStore.getDailyCount(monitorId, today);
        if (sentToday >= alertScoringConfig.getDailyAlertLimit()) {
            log.info(
                    "Daily alert limit reached for monitor {} ({}/{})",
                    monitorId,
                    sentToday,
                    alertScoringConfig.getDailyAlertLimit());
            return false;
        }

        if (!priority.isShouldNotify()) {
            log.debug("Alert for monitor {} not delivered: tier {} does not notify", monitorId, priority.getUrgencyLevel());
            return false;
        }

        LocalDateTime expiresAt = priority.getThrottleUntil() != null
                ? priority.getThrottleUntil()
                : now.plusHours(alertScoringConfig.getDedupWindowHours());
        alertDedupStore.recordSent(monitorId, hash, expiresAt, today, now);
        if (priority.getUrgencyLevel() == UrgencyLevel.MEDIUM) {
            alertDedupStore.markBatched(monitorId, now.plusHours(UrgencyLevel.MEDIUM.getThrottleHours()));
        }
        return true;
    }

    public AlertStatistics getAlertStatistics(String monitorId) {
        LocalDateTime now = LocalDateTime.now(clock);
        int daily = alertDedupStore.getDailyCount(monitorId, now.toLocalDate());
        LocalDateTime throttleUntil = alertDedupStore.getThrottleUntil(monitorId);
        return AlertStatistics.builder()
                .monitorId(monitorId)
                .recentAlertCount(alertDedupStore.getActiveHashCount(monitorId, now))
                .dailyAlertCount(daily)
                .dailyLimit(alertScoringConfig.getDailyAlertLimit())
                .remainingQuota(Math.max(0, alertScoringConfig.getDailyAlertLimit() - daily))
                .throttleActive(throttleUntil != null && throttleUntil.isAfter(now))
                .build();
    }

    /**
     * Records user feedback on a delivered alert. Feedback is tallied per verdict for
     * later threshold tuning; it does not change scoring today.
     */
    public void incorporateFeedback(String alertId, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            return;
        }
        String verdict = feedback.trim().toLowerCase(Locale.ROOT);
        feedbackCounts.computeIfAbsent(verdict, k -> new AtomicInteger()).incrementAndGet();
        log.info("Feedback '{}' recorded for alert {}", verdict, alertId);
    }

    public Map<String, Integer> getFeedbackCounts() {
        return Collections.unmodifiableMap(feedbackCounts.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get())));
    }

    public void clear(String monitorId) {
        alertDedupStore.clear(monitorId);
        log.info("Cleared alert dedup state for monitor {}", monitorId);
    }

    /**
     * MD5 of the alert's sorted {@code category:title} pairs joined by '|'. Anomalies take part
     * as {@code anomaly:type:metric} so anomaly-only alerts are deduplicated too.
     */
    public static String contentHash(Alert alert) {
        Set<String> keys = new LinkedHashSet<>();
        if (alert.getChanges() != null) {
            for (Change change : alert.getChanges()) {
                keys.add(change.getChangeType() + ":" + change.getTitle());
            }
        }
        if (alert.getAnomalyScores() != null) {
            for (AnomalyScore anomaly : alert.getAnomalyScores()) {
                keys.add("anomaly:" + anomaly.getAnomalyType() + ":" + anomaly.getMetricName());
            }
        }
        return ContentHash.md5(keys.stream().sorted().collect(Collectors.joining("|")));
    }

    private boolean tierNotifies(UrgencyLevel urgency, String monitorId, LocalDateTime now) {
        return switch (urgency) {
            case CRITICAL, HIGH -> true;
            case MEDIUM -> !alertDedupStore.isBatched(monitorId, now);
            case LOW -> false;
        };
    }
}

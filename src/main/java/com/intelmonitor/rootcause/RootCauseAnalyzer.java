package com.intelmonitor.rootcause;

import com.intelmonitor.domain.enums.AlertSeverity;
import com.intelmonitor.domain.enums.ChangeType;
import com.intelmonitor.domain.enums.TimeToImpact;
import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.Change;
import com.intelmonitor.domain.model.ContributingFactor;
import com.intelmonitor.domain.model.PrioritizedAction;
import com.intelmonitor.domain.model.RootCauseExplanation;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Explains an alert: most likely root cause, contributing factors, impact, severity and
 * a prioritized action list.
 *
 * <p>The root cause is an ordered pattern match over the change categories present;
 * the first matching pattern wins:
 * <ol>
 *   <li>competitive landscape + market trend: competitive pressure (0.85)</li>
 *   <li>market trend with demand/adoption/growth/decline wording: demand shift (0.80)</li>
 *   <li>financial metric: financial performance deviation (0.75)</li>
 *   <li>regulatory: regulatory environment change (0.90)</li>
 *   <li>strategic shift: internal realignment (0.70)</li>
 *   <li>technology: technological disruption (0.75)</li>
 *   <li>leadership: leadership transition (0.80)</li>
 * </ol>
 * Anything else falls through to a generic "multiple contributing factors" cause (0.65).
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class RootCauseAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RootCauseAnalyzer.class);

    public static final String NO_HISTORY = "No historical context available for comparison.";
    static final String MONITORING_RECOMMENDATION =
            "Increase monitoring frequency to 2x current cadence for early detection";

    private static final double HIGH_CONFIDENCE = 0.8;
    private static final double GENERIC_CONFIDENCE = 0.65;
    private static final int MAX_RELATED_ALERTS = 5;
    private static final int IMPACT_EXCERPT_LENGTH = 100;

    private static final List<String> DEMAND_KEYWORDS = List.of("demand", "adoption", "growth", "decline");

    private static final Set<ChangeType> HIGH_IMPACT_TYPES = EnumSet.of(
            ChangeType.COMPETITIVE_LANDSCAPE,
            ChangeType.REGULATORY,
            ChangeType.STRATEGIC_SHIFT,
            ChangeType.FINANCIAL_METRIC);

    private static final Set<ChangeType> INTERNAL_TYPES =
            EnumSet.of(ChangeType.STRATEGIC_SHIFT, ChangeType.LEADERSHIP, ChangeType.FINANCIAL_METRIC);
    private static final Set<ChangeType> MARKET_TYPES =
            EnumSet.of(ChangeType.MARKET_TREND, ChangeType.COMPETITIVE_LANDSCAPE);

    /**
     * Analyzes an alert. {@code recentAlerts} is the monitor's recent alert history; pass
     * null when none was loaded.
     */
    public RootCauseExplanation analyze(Alert alert, List<Alert> recentAlerts) {
        List<Change> changes = alert.getChanges() != null ? alert.getChanges() : List.of();
        Set<ChangeType> types = changes.stream()
                .map(Change::getChangeType)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ChangeType.class)));

        CauseMatch cause = matchCause(types, changes);
        if (cause.confidence() == GENERIC_CONFIDENCE) {
            log.warn("No root cause pattern matched alert {} ({}), using generic cause", alert.getId(), types);
        }

        AlertSeverity severity = calculateSeverity(changes);
        TimeToImpact timeToImpact = estimateTimeToImpact(types);
        String impact = assessImpact(changes);
        List<String> mitigations = mitigationStrategies(types);
        List<String> recommendations = recommendations(types);

        return RootCauseExplanation.builder()
                .summary(executiveSummary(alert, changes.size(), severity, cause, timeToImpact, impact, recommendations))
                .whatHappened(changes.stream()
                        .map(c -> c.getTitle() + " (" + c.getChangeType().name().toLowerCase(Locale.ROOT) + ")")
                        .collect(Collectors.toCollection(ArrayList::new)))
                .whyItMatters(whyItMatters(types, severity, timeToImpact, impact))
                .rootCause(cause.description())
                .rootCauseConfidence(cause.confidence())
                .contributingFactors(contributingFactors(changes))
                .impactAssessment(impact)
                .timeToImpact(timeToImpact)
                .severity(severity)
                .mitigationStrategies(mitigations)
                .recommendedActions(recommendations)
                .prioritizedActions(prioritizedActions(cause, mitigations))
                .historicalContext(historicalContext(alert, types, recentAlerts))
                .relatedAlerts(relatedAlerts(alert, types, recentAlerts))
                .build();
    }

    public CauseMatch matchCause(Set<ChangeType> types, List<Change> changes) {
        if (types.contains(ChangeType.COMPETITIVE_LANDSCAPE) && types.contains(ChangeType.MARKET_TREND)) {
            return new CauseMatch("Increased competitive pressure from new market entrants or competitor actions", 0.85);
        }
        if (types.contains(ChangeType.MARKET_TREND) && hasDemandSignal(changes)) {
            return new CauseMatch(
                    "Market demand shift driven by changing customer preferences or external factors", 0.80);
        }
        if (types.contains(ChangeType.FINANCIAL_METRIC)) {
            return new CauseMatch("Financial performance deviation indicating operational or market challenges", 0.75);
        }
        if (types.contains(ChangeType.REGULATORY)) {
            return new CauseMatch("Regulatory environment change requiring compliance and strategic adjustments", 0.90);
        }
        if (types.contains(ChangeType.STRATEGIC_SHIFT)) {
            return new CauseMatch("Internal strategic realignment or pivot in response to market conditions", 0.70);
        }
        if (types.contains(ChangeType.TECHNOLOGY)) {
            return new CauseMatch("Technological advancement creating disruption or new opportunities", 0.75);
        }
        if (types.contains(ChangeType.LEADERSHIP)) {
            return new CauseMatch("Leadership transition driving organizational and strategic changes", 0.80);
        }
        return new CauseMatch(
                "Multiple contributing factors across " + types.size() + " areas", GENERIC_CONFIDENCE);
    }

    public AlertSeverity calculateSeverity(List<Change> changes) {
        long highConfidence = changes.stream()
                .filter(c -> c.getConfidence() >= HIGH_CONFIDENCE)
                .count();
        int total = changes.size();
        if (highConfidence >= 3 || (highConfidence >= 2 && total >= 4)) {
            return AlertSeverity.CRITICAL;
        }
        if (highConfidence >= 2 || total >= 3) {
            return AlertSeverity.HIGH;
        }
        if (highConfidence >= 1 || total >= 2) {
            return AlertSeverity.MEDIUM;
        }
        return AlertSeverity.LOW;
    }

    public TimeToImpact estimateTimeToImpact(Set<ChangeType> types) {
        if (types.contains(ChangeType.REGULATORY) || types.contains(ChangeType.FINANCIAL_METRIC)) {
            return TimeToImpact.IMMEDIATE;
        }
        if (types.contains(ChangeType.COMPETITIVE_LANDSCAPE) || types.contains(ChangeType.LEADERSHIP)) {
            return TimeToImpact.SHORT_TERM;
        }
        return TimeToImpact.MEDIUM_TERM;
    }

    /** Tiered by the number of changes (not categories) in high-impact categories. */
    public String assessImpact(List<Change> changes) {
        long highImpact = changes.stream()
                .filter(c -> HIGH_IMPACT_TYPES.contains(c.getChangeType()))
                .count();
        if (highImpact >= 3) {
            return "CRITICAL IMPACT: Multiple high-severity changes requiring immediate executive attention. "
                    + "Failure to address could result in significant market share loss, regulatory penalties, "
                    + "or strategic misalignment within 3-6 months.";
        }
        if (highImpact >= 2) {
            return "HIGH IMPACT: Significant changes that could affect competitive position and financial "
                    + "performance. Recommend strategic review within 2-4 weeks to mitigate risks.";
        }
        if (highImpact >= 1) {
            return "MODERATE IMPACT: Important changes requiring monitoring and potential tactical adjustments. "
                    + "Address within 1-2 months to prevent escalation.";
        }
        return "LOW IMPACT: Minor changes for awareness and tracking. "
                + "Monitor trends but no immediate action required.";
    }

    private List<ContributingFactor> contributingFactors(List<Change> changes) {
        List<ContributingFactor> factors = new ArrayList<>();
        addFactor(factors, changes, INTERNAL_TYPES, "Internal operational or strategic decisions", 0.7, "internal");
        addFactor(factors, changes, MARKET_TYPES, "External market dynamics and competitive forces", 0.8, "market");
        addFactor(
                factors,
                changes,
                EnumSet.of(ChangeType.REGULATORY),
                "Regulatory compliance requirements",
                0.9,
                "regulatory");
        addFactor(
                factors,
                changes,
                EnumSet.of(ChangeType.TECHNOLOGY),
                "Technological advancement or disruption",
                0.75,
                "technology");
        return factors;
    }

    private static void addFactor(
            List<ContributingFactor> factors,
            List<Change> changes,
            Set<ChangeType> bucket,
            String description,
            double confidence,
            String category) {
        List<String> evidence = changes.stream()
                .filter(c -> bucket.contains(c.getChangeType()))
                .map(Change::getTitle)
                .collect(Collectors.toCollection(ArrayList::new));
        if (!evidence.isEmpty()) {
            factors.add(ContributingFactor.builder()
                    .factor(description)
                    .confidence(confidence)
                    .category(category)
                    .evidence(evidence)
                    .build());
        }
    }

    private List<String> mitigationStrategies(Set<ChangeType> types) {
        Set<String> strategies = new LinkedHashSet<>();
        if (types.contains(ChangeType.COMPETITIVE_LANDSCAPE)) {
            strategies.add("Conduct competitive intelligence deep-dive to understand competitor strategies and intentions");
            strategies.add("Accelerate product roadmap to maintain competitive differentiation");
        }
        if (types.contains(ChangeType.MARKET_TREND)) {
            strategies.add("Launch targeted market research to validate demand trends and customer sentiment");
            strategies.add("Consider strategic pivot or product repositioning based on market signals");
        }
        if (types.contains(ChangeType.FINANCIAL_METRIC)) {
            strategies.add("Implement cost optimization initiatives to improve margins");
            strategies.add("Review pricing strategy and value proposition alignment");
        }
        if (types.contains(ChangeType.REGULATORY)) {
            strategies.add("Engage compliance team and legal counsel for regulatory impact assessment");
            strategies.add("Develop compliance roadmap with clear milestones and accountability");
        }
        if (strategies.isEmpty()) {
            strategies.add("Establish cross-functional task force to assess situation and develop response plan");
            strategies.add("Increase monitoring frequency to detect further changes early");
        }
        return new ArrayList<>(strategies);
    }

    private List<String> recommendations(Set<ChangeType> types) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add(MONITORING_RECOMMENDATION);
        if (types.contains(ChangeType.COMPETITIVE_LANDSCAPE)) {
            recommendations.add("Schedule competitive strategy review with executive team within 2 weeks");
        }
        if (types.contains(ChangeType.FINANCIAL_METRIC)) {
            recommendations.add("Conduct financial variance analysis to identify drivers");
        }
        if (types.contains(ChangeType.REGULATORY)) {
            recommendations.add("Initiate compliance gap analysis and remediation planning");
        }
        return recommendations;
    }

    private List<PrioritizedAction> prioritizedActions(CauseMatch cause, List<String> mitigations) {
        List<PrioritizedAction> actions = new ArrayList<>();
        actions.add(new PrioritizedAction(
                "1 - URGENT", "Assess root cause: " + cause.description(), "Strategy Team", "24-48 hours"));
        if (!mitigations.isEmpty()) {
            actions.add(new PrioritizedAction("2 - HIGH", mitigations.get(0), "Operations/Strategy", "1-2 weeks"));
        }
        actions.add(new PrioritizedAction(
                "3 - MEDIUM", "Develop strategic response plan with clear KPIs", "Executive Team", "2-4 weeks"));
        return actions;
    }

    private String whyItMatters(
            Set<ChangeType> types, AlertSeverity severity, TimeToImpact timeToImpact, String impact) {
        StringBuilder text = new StringBuilder()
                .append("This alert indicates ")
                .append(severity.name().toLowerCase(Locale.ROOT))
                .append("-severity changes with ")
                .append(timeToImpact.getLabel())
                .append(" impact. ");
        if (types.contains(ChangeType.COMPETITIVE_LANDSCAPE)) {
            text.append("Competitive position may be at risk, potentially affecting market share and pricing power. ");
        }
        if (types.contains(ChangeType.FINANCIAL_METRIC)) {
            text.append("Financial performance deviation could impact investor confidence and strategic initiatives. ");
        }
        if (types.contains(ChangeType.REGULATORY)) {
            text.append("Regulatory changes may require significant compliance investments and operational adjustments. ");
        }
        return text.append(impact).toString();
    }

    private String executiveSummary(
            Alert alert,
            int changeCount,
            AlertSeverity severity,
            CauseMatch cause,
            TimeToImpact timeToImpact,
            String impact,
            List<String> recommendations) {
        String excerpt = impact.substring(0, Math.min(IMPACT_EXCERPT_LENGTH, impact.length()));
        String action = recommendations.isEmpty() ? "Review and assess" : recommendations.get(0);
        return severity.name() + " ALERT: " + changeCount + " significant changes detected for "
                + alert.getMonitorId() + ". Root cause: " + cause.description() + ". Impact: "
                + timeToImpact.getLabel() + " (" + excerpt + "...). Recommended action: " + action + ".";
    }

    private String historicalContext(Alert alert, Set<ChangeType> types, List<Alert> recentAlerts) {
        List<Alert> prior = priorAlerts(alert, recentAlerts);
        if (prior.isEmpty()) {
            return NO_HISTORY;
        }
        long overlapping = prior.stream().filter(a -> sharesCategory(a, types)).count();
        return prior.size() + " prior alerts in the lookback window; " + overlapping
                + " share change categories with this alert.";
    }

    private List<String> relatedAlerts(Alert alert, Set<ChangeType> types, List<Alert> recentAlerts) {
        return priorAlerts(alert, recentAlerts).stream()
                .filter(a -> sharesCategory(a, types))
                .map(Alert::getId)
                .limit(MAX_RELATED_ALERTS)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<Alert> priorAlerts(Alert alert, List<Alert> recentAlerts) {
        if (recentAlerts == null) {
            return List.of();
        }
        return recentAlerts.stream()
                .filter(a -> a.getId() == null || !a.getId().equals(alert.getId()))
                .toList();
    }

    private static boolean sharesCategory(Alert other, Set<ChangeType> types) {
        return other.getChanges() != null
                && other.getChanges().stream().anyMatch(c -> types.contains(c.getChangeType()));
    }

    private static boolean hasDemandSignal(List<Change> changes) {
        return changes.stream()
                .map(Change::getDescription)
                .filter(Objects::nonNull)
                .map(d -> d.toLowerCase(Locale.ROOT))
                .anyMatch(d -> DEMAND_KEYWORDS.stream().anyMatch(d::contains));
    }

    public record CauseMatch(String description, double confidence) {}
}

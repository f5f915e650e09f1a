package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.AlertSeverity;
import com.intelmonitor.domain.enums.TimeToImpact;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Explanation payload attached to an alert by the root cause analyzer.
 *
 * <p>{@code summary} is an executive one-paragraph digest; {@code whatHappened}
 * lists one line per change; {@code rootCause} is the primary cause from the ordered
 * pattern table with its fixed confidence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RootCauseExplanation {

    private String summary;

    @Builder.Default
    private List<String> whatHappened = new ArrayList<>();

    private String whyItMatters;
    private String rootCause;
    private double rootCauseConfidence;

    @Builder.Default
    private List<ContributingFactor> contributingFactors = new ArrayList<>();

    private String impactAssessment;
    private TimeToImpact timeToImpact;
    private AlertSeverity severity;

    @Builder.Default
    private List<String> mitigationStrategies = new ArrayList<>();

    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    @Builder.Default
    private List<PrioritizedAction> prioritizedActions = new ArrayList<>();

    private String historicalContext;

    @Builder.Default
    private List<String> relatedAlerts = new ArrayList<>();
}

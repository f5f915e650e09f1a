package com.intelmonitor.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw output of the external analysis engine, consumed once per check cycle to
 * build a {@link Snapshot}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    @Builder.Default
    private Map<String, Object> financialMetrics = new LinkedHashMap<>();

    @Builder.Default
    private List<String> marketTrends = new ArrayList<>();

    @Builder.Default
    private Map<String, String> competitiveForces = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> strategicPosition = new LinkedHashMap<>();

    private Double newsSentiment;

    @Builder.Default
    private Map<String, Integer> competitorMentions = new LinkedHashMap<>();
}

package com.intelmonitor.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Immutable point-in-time capture of a monitored company's analyzed state.
 *
 * <p>Created once per check cycle from the analysis engine's output. Readers never
 * see compressed fields; compression is handled inside the snapshot store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Snapshot {

    private Long id;
    private String monitorId;
    private LocalDateTime timestamp;
    private String company;
    private String industry;

    /** Named metric values. Numeric entries are compared; others are carried through. */
    @Builder.Default
    private Map<String, Object> financialMetrics = new LinkedHashMap<>();

    @Builder.Default
    private List<String> marketTrends = new ArrayList<>();

    /** Free-text sections keyed by force name (e.g. "supplier_power"). */
    @Builder.Default
    private Map<String, String> competitiveForces = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> strategicPosition = new LinkedHashMap<>();

    private Double newsSentiment;

    @Builder.Default
    private Map<String, Integer> competitorMentions = new LinkedHashMap<>();
}

package com.intelmonitor.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The unit of notification: a bundle of changes plus anomaly and root-cause context.
 *
 * <p>Alerts are append-only. After creation only the read flag, feedback and the
 * action-taken note are mutated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;
    private String monitorId;
    private String title;
    private String summary;
    private double confidence;

    @Builder.Default
    private List<Change> changes = new ArrayList<>();

    @Builder.Default
    private List<AnomalyScore> anomalyScores = new ArrayList<>();

    private AlertPriority priority;
    private RootCauseExplanation rootCause;
    private LocalDateTime createdAt;

    /** True when the alert passed dedup, cap and tier checks and was handed to the dispatcher. */
    private boolean notified;

    private boolean read;
    private LocalDateTime readAt;
    private String userFeedback;
    private String actionTaken;
}

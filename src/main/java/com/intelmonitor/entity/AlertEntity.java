package com.intelmonitor.entity;

import com.intelmonitor.domain.enums.UrgencyLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alerts table. Rows are never deleted.
 *
 * <p>Changes, anomaly scores, priority and root cause are JSON documents; priority
 * score and urgency are also broken out as columns for filtering.
 */
@Entity
@Table(name = "alerts", indexes = @Index(name = "idx_alerts_monitor_created", columnList = "monitor_id, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "monitor_id", nullable = false, length = 36)
    private String monitorId;

    @Column(length = 500)
    private String title;

    @Column(columnDefinition = "CLOB")
    private String summary;

    private double confidence;

    @Column(columnDefinition = "CLOB")
    private String changes;

    @Column(name = "anomaly_scores", columnDefinition = "CLOB")
    private String anomalyScores;

    @Column(columnDefinition = "CLOB")
    private String priority;

    @Column(name = "priority_score")
    private Double priorityScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "urgency_level", length = 20)
    private UrgencyLevel urgencyLevel;

    @Column(name = "root_cause", columnDefinition = "CLOB")
    private String rootCause;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    private boolean notified;

    @Column(name = "is_read")
    private boolean read;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @Column(name = "user_feedback", length = 2000)
    private String userFeedback;

    @Column(name = "action_taken", length = 500)
    private String actionTaken;
}

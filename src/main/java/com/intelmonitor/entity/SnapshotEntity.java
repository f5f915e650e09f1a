package com.intelmonitor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
 * JPA entity for the snapshots table.
 *
 * <p>Map and list fields are JSON strings. The three large sections
 * (financial_metrics, competitive_forces, strategic_position) may hold a
 * {@code gz:}-prefixed Base64 gzip payload instead of plain JSON; the snapshot store
 * decodes them on read.
 */
@Entity
@Table(name = "snapshots", indexes = @Index(name = "idx_snapshots_monitor_ts", columnList = "monitor_id, timestamp"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "monitor_id", nullable = false, length = 36)
    private String monitorId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(length = 200)
    private String company;

    @Column(length = 200)
    private String industry;

    @Column(name = "financial_metrics", columnDefinition = "CLOB")
    private String financialMetrics;

    @Column(name = "market_trends", columnDefinition = "CLOB")
    private String marketTrends;

    @Column(name = "competitive_forces", columnDefinition = "CLOB")
    private String competitiveForces;

    @Column(name = "strategic_position", columnDefinition = "CLOB")
    private String strategicPosition;

    @Column(name = "news_sentiment")
    private Double newsSentiment;

    @Column(name = "competitor_mentions", columnDefinition = "CLOB")
    private String competitorMentions;
}

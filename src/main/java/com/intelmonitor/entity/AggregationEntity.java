package com.intelmonitor.entity;

import com.intelmonitor.domain.enums.AggregationPeriod;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the aggregations table. One row per (monitor, period, window start).
 */
@Entity
@Table(
        name = "aggregations",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_aggregations_window",
                        columnNames = {"monitor_id", "period", "start_time"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AggregationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "monitor_id", nullable = false, length = 36)
    private String monitorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AggregationPeriod period;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Column(name = "snapshot_count")
    private int snapshotCount;

    @Column(columnDefinition = "CLOB")
    private String metrics;

    @Column(columnDefinition = "CLOB")
    private String trends;

    @Column(name = "moving_averages", columnDefinition = "CLOB")
    private String movingAverages;

    @Column(name = "significant_changes", columnDefinition = "CLOB")
    private String significantChanges;

    @Column(name = "most_common_trends", columnDefinition = "CLOB")
    private String mostCommonTrends;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}

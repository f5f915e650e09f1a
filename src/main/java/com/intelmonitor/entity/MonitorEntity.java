package com.intelmonitor.entity;

import com.intelmonitor.domain.enums.MonitorStatus;
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
 * JPA entity for the monitors table.
 *
 * <p>Settings are stored as a JSON document. The (status, next_check) index backs the
 * scheduler's "due for check" query; (user_id, company, status) backs the
 * one-active-monitor-per-subject rule.
 */
@Entity
@Table(
        name = "monitors",
        indexes = {
            @Index(name = "idx_monitors_due", columnList = "status, next_check"),
            @Index(name = "idx_monitors_owner_subject", columnList = "user_id, company, status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitorEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(nullable = false, length = 200)
    private String company;

    @Column(nullable = false, length = 200)
    private String industry;

    @Column(columnDefinition = "CLOB")
    private String settings;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MonitorStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_check")
    private LocalDateTime lastCheck;

    @Column(name = "next_check")
    private LocalDateTime nextCheck;

    @Column(name = "last_alert_id", length = 36)
    private String lastAlertId;

    @Column(name = "total_alerts")
    private int totalAlerts;

    @Column(name = "error_count")
    private int errorCount;

    @Column(name = "last_error", length = 1000)
    private String lastError;
}

package com.intelmonitor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for alert scoring, deduplication and throttling.
 */
@Configuration
@ConfigurationProperties(prefix = "intelmonitor.alert-scoring")
@Getter
@Setter
public class AlertScoringConfig {

    /** Maximum alerts delivered per monitor per calendar day. */
    private int dailyAlertLimit = 5;

    /** How long a delivered change-set hash suppresses identical alerts, in hours. */
    private int dedupWindowHours = 24;

    /** Dedup/throttle backing store: "memory" (single instance) or "redis" (shared). */
    private String dedupStore = "memory";
}

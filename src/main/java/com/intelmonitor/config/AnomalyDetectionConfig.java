package com.intelmonitor.config;

import com.intelmonitor.domain.enums.AnomalySensitivity;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for forecast-based anomaly detection.
 */
@Configuration
@ConfigurationProperties(prefix = "intelmonitor.anomaly")
@Getter
@Setter
public class AnomalyDetectionConfig {

    /** Forecast interval width. BALANCED = 80%. */
    private AnomalySensitivity sensitivity = AnomalySensitivity.BALANCED;

    /** Minimum number of finite points required to fit a model. */
    private int minTrainingPoints = 14;

    /** History window, in days, used to train models during a check cycle. */
    private int historyWindowDays = 30;

    /** Seasonal period of the default model, in days (weekly). */
    private int seasonalityPeriodDays = 7;

    /** Recent window, in days, for trend reversal analysis. */
    private int trendRecentWindowDays = 7;
}

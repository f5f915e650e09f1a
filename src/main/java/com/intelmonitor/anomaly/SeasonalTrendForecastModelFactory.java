package com.intelmonitor.anomaly;

import com.intelmonitor.config.AnomalyDetectionConfig;
import org.springframework.stereotype.Component;

@Component
public class SeasonalTrendForecastModelFactory implements ForecastModelFactory {

    private final AnomalyDetectionConfig anomalyDetectionConfig;

    public SeasonalTrendForecastModelFactory(AnomalyDetectionConfig anomalyDetectionConfig) {
        this.anomalyDetectionConfig = anomalyDetectionConfig;
    }

    @Override
    public ForecastModel create() {
        return new SeasonalTrendForecastModel(anomalyDetectionConfig.getSeasonalityPeriodDays());
    }
}

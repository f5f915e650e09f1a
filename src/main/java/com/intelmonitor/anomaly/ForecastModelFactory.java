package com.intelmonitor.anomaly;

/**
 * Creates unfitted forecast models. Swap the bean to plug in another forecasting library.
 */
public interface ForecastModelFactory {

    ForecastModel create();
}

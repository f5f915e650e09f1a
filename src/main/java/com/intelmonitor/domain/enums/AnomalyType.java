package com.intelmonitor.domain.enums;

/**
 * Kind of anomaly emitted by the anomaly detector.
 * <ul>
 *   <li>POINT: value outside the forecast interval</li>
 *   <li>CONTEXTUAL: point anomaly adjusted for a known high-variance period</li>
 *   <li>TREND_REVERSAL: direction of the trend component flipped</li>
 *   <li>VOLATILITY_SPIKE: recent dispersion far above historical dispersion</li>
 * </ul>
 */
public enum AnomalyType {
    POINT,
    CONTEXTUAL,
    TREND_REVERSAL,
    VOLATILITY_SPIKE
}

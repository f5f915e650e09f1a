package com.intelmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Width of the forecast confidence interval. Narrower intervals flag more anomalies.
 */
@Getter
@RequiredArgsConstructor
public enum AnomalySensitivity {
    CONSERVATIVE(0.95),
    BALANCED(0.80),
    AGGRESSIVE(0.60);

    private final double intervalWidth;
}

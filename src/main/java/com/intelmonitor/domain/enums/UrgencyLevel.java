package com.intelmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Urgency tier assigned by the alert scorer.
 *
 * <p>Tiers by score:
 * <ul>
 *   <li>CRITICAL (&ge;8): always notify, repeat-throttle 1h</li>
 *   <li>HIGH (&ge;6): notify, throttle 4h</li>
 *   <li>MEDIUM (&ge;4): notify unless already batched this window, throttle 4h</li>
 *   <li>LOW (&lt;4): in-app only, throttle 24h</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum UrgencyLevel {
    CRITICAL(8.0, 1),
    HIGH(6.0, 4),
    MEDIUM(4.0, 4),
    LOW(0.0, 24);

    private final double minScore;
    private final int throttleHours;

    public static UrgencyLevel fromScore(double score) {
        for (UrgencyLevel level : values()) {
            if (score >= level.minScore) {
                return level;
            }
        }
        return LOW;
    }
}

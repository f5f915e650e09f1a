package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.UrgencyLevel;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scorer verdict for an alert: 0-10 priority score, urgency tier, whether the tier
 * notifies, human-readable reasoning lines and the throttle horizon.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertPriority {

    private double score;
    private UrgencyLevel urgencyLevel;
    private boolean shouldNotify;
    private List<String> reasoning;
    private LocalDateTime throttleUntil;
}

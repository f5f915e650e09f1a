package com.intelmonitor.domain.enums;

import java.time.Duration;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How often a monitor is re-analyzed. Monthly is a fixed 30 days, not a calendar month.
 */
@Getter
@RequiredArgsConstructor
public enum MonitoringFrequency {
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration interval;
}

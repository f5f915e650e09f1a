package com.intelmonitor.domain.enums;

/**
 * Calendar window used for snapshot rollups. Daily runs midnight to midnight,
 * weekly Monday to Monday, monthly first-of-month to first-of-next-month.
 */
public enum AggregationPeriod {
    DAILY,
    WEEKLY,
    MONTHLY
}

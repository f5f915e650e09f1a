package com.intelmonitor.domain.enums;

/**
 * Category of a detected change between two snapshots.
 */
public enum ChangeType {
    COMPETITIVE_LANDSCAPE,
    MARKET_TREND,
    FINANCIAL_METRIC,
    STRATEGIC_SHIFT,
    REGULATORY,
    TECHNOLOGY,
    LEADERSHIP
}

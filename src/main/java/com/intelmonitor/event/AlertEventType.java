package com.intelmonitor.event;

/**
 * Classifies what happened to an alert.
 */
public enum AlertEventType {

    /** Alert persisted (delivered or not). */
    CREATED,

    /** Alert passed dedup, cap and tier checks; the dispatcher should deliver it. */
    DISPATCH_REQUESTED,

    /** Alert persisted but not delivered (duplicate, daily cap, or non-notifying tier). */
    SUPPRESSED,

    READ,

    FEEDBACK
}

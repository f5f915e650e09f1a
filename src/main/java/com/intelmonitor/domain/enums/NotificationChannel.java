package com.intelmonitor.domain.enums;

/**
 * Delivery channels a monitor may request. Delivery itself belongs to the
 * downstream dispatcher; this engine only passes the list along.
 */
public enum NotificationChannel {
    EMAIL,
    CHAT,
    WEBHOOK,
    IN_APP
}

package com.nosota.wagerbook.api.model;

/**
 * Lifecycle of a sporting event. Only SCHEDULED events accept wagers.
 */
public enum EventStatus {
    SCHEDULED,
    LIVE,
    FINAL
}

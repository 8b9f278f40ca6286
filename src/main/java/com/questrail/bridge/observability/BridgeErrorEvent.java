package com.questrail.bridge.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bridge.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

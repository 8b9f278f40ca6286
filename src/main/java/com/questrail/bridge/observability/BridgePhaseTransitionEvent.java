package com.questrail.bridge.observability;

import com.questrail.bridge.protocol.listener.internal.exec.BridgePhase;

import java.time.Instant;

/**
 * Record representing one phase change of the listener loop.
 */
public record BridgePhaseTransitionEvent(
    Instant timestamp,
    BridgePhase from,
    BridgePhase to
) {
    public boolean isTermination() {
        return to == BridgePhase.STOPPED;
    }
}

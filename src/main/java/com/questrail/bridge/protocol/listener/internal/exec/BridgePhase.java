package com.questrail.bridge.protocol.listener.internal.exec;

import java.util.EnumSet;
import java.util.Set;

/**
 * BridgePhase
 * -----------------------------------------------------------------------------
 * Where the listener loop is within one event cycle.
 *
 * <pre>
 *   AWAITING_EVENT -> READING_HEADER -> READING_PAYLOAD -> DECODING
 *       -> EVALUATING -> DISPATCHING -> ACKNOWLEDGING -> AWAITING_EVENT
 *
 *   DECODING   -> ACKNOWLEDGING   (undecodable or ignored event)
 *   EVALUATING -> ACKNOWLEDGING   (no actions, or evaluation failed)
 *   any I/O phase -> STOPPED
 * </pre>
 *
 * <p>Only the phases that touch the channel ({@code AWAITING_EVENT},
 * {@code READING_HEADER}, {@code READING_PAYLOAD}, {@code ACKNOWLEDGING}) can
 * end the loop. {@code STOPPED} is terminal.</p>
 */
public enum BridgePhase
{
    AWAITING_EVENT,
    READING_HEADER,
    READING_PAYLOAD,
    DECODING,
    EVALUATING,
    DISPATCHING,
    ACKNOWLEDGING,
    STOPPED;

    private Set<BridgePhase> successors;

    static {
        AWAITING_EVENT.successors = EnumSet.of(READING_HEADER, STOPPED);
        READING_HEADER.successors = EnumSet.of(READING_PAYLOAD, STOPPED);
        READING_PAYLOAD.successors = EnumSet.of(DECODING, STOPPED);
        DECODING.successors = EnumSet.of(EVALUATING, ACKNOWLEDGING);
        EVALUATING.successors = EnumSet.of(DISPATCHING, ACKNOWLEDGING);
        DISPATCHING.successors = EnumSet.of(ACKNOWLEDGING);
        ACKNOWLEDGING.successors = EnumSet.of(AWAITING_EVENT, STOPPED);
        STOPPED.successors = EnumSet.noneOf(BridgePhase.class);
    }

    public boolean canTransitionTo(BridgePhase next) {
        return successors.contains(next);
    }

    public boolean isTerminal() {
        return successors.isEmpty();
    }
}

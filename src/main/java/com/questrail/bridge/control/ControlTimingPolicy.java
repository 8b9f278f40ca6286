package com.questrail.bridge.control;

import java.time.Duration;
import java.util.Objects;

/**
 * ControlTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for control calls.
 *
 * <p>{@code callTimeout} bounds each XML-RPC call end to end, including time
 * spent waiting for another caller to finish. It never alters fault
 * classification; an expired call is reported as
 * {@link com.questrail.bridge.api.ControlOutcome#UNREACHABLE}.</p>
 */
public record ControlTimingPolicy(Duration callTimeout)
{
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(3);

    public ControlTimingPolicy {
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }

    public static ControlTimingPolicy defaults() {
        return new ControlTimingPolicy(DEFAULT_CALL_TIMEOUT);
    }
}

package com.questrail.bridge.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp decoded events and observability records.
 *
 * <p>This clock may jump. It MUST NOT be used for cooldown or timeout
 * arithmetic; use {@link MonotonicClock} for that.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}

package com.questrail.bridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the bridge.
 *
 * <h2>Binding invariant</h2>
 * Rule cooldowns and control-call deadlines MUST be measured against a
 * monotonic source. Wall-clock time ({@code Instant.now()}) is reserved for
 * event timestamps and log output.
 *
 * <p>Tests substitute a manually advanced implementation so cooldown windows
 * can be crossed without sleeping.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Only differences between two readings are meaningful.
     */
    long nowNanos();
}

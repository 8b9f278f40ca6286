package com.questrail.bridge.rules;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * CooldownState
 * -----------------------------------------------------------------------------
 * Last-fired tick per {@code (ruleId, processName)}.
 *
 * <p>Keyed by distinct process name: two instances of one program group are
 * rate-limited independently. Ticks come from a monotonic clock, so only
 * differences between them mean anything.</p>
 *
 * <p>Lives as long as the bridge process and is lost on restart; cooldowns are
 * a rate limit, not a correctness guarantee.</p>
 *
 * <p>Not thread-safe. Owned by one {@link RuleEngine}, which is driven by the
 * single bridge loop.</p>
 */
public final class CooldownState
{
    private record Key(String ruleId, String processName) {}

    private final Map<Key, Long> lastFiredNanos = new HashMap<>();

    /**
     * True if the pair fired less than {@code cooldown} ago.
     * A pair that never fired, or a zero cooldown, is never cooling down.
     */
    public boolean isCoolingDown(String ruleId, String processName, Duration cooldown, long nowNanos)
    {
        Long last = lastFiredNanos.get(new Key(ruleId, processName));
        if (last == null || cooldown.isZero()) {
            return false;
        }
        return nowNanos - last < cooldown.toNanos();
    }

    public void recordFire(String ruleId, String processName, long nowNanos)
    {
        lastFiredNanos.put(new Key(
                Objects.requireNonNull(ruleId, "ruleId"),
                Objects.requireNonNull(processName, "processName")), nowNanos);
    }

    public OptionalLong lastFired(String ruleId, String processName)
    {
        Long last = lastFiredNanos.get(new Key(ruleId, processName));
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    public int size()
    {
        return lastFiredNanos.size();
    }
}

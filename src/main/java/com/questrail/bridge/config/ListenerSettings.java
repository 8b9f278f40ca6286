package com.questrail.bridge.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Listener-side operational settings, resolved from {@link ListenerSection}.
 *
 * @param idleTimeout              longest wait for the daemon's next bytes;
 *                                 {@link Duration#ZERO} waits forever
 * @param exitOnSupervisorStopping end the loop after acknowledging the daemon's
 *                                 own {@code STOPPING} event
 */
public record ListenerSettings(Duration idleTimeout, boolean exitOnSupervisorStopping)
{
    public ListenerSettings {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be non-negative");
        }
    }

    public static ListenerSettings defaults() {
        return new ListenerSettings(Duration.ZERO, true);
    }
}

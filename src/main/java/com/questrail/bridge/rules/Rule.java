package com.questrail.bridge.rules;

import java.time.Duration;
import java.util.Objects;

/**
 * One configured reaction: when {@link #match()} accepts an event, emit an
 * {@link Action} of kind {@link #action()}, at most once per
 * {@link #cooldown()} for any given process.
 *
 * <p>The meaning of {@code payload} depends on the action kind: a message
 * template for {@link ActionKind#NOTIFY}, the dependent process name for
 * {@link ActionKind#RESTART_DEPENDENT}, a control command such as
 * {@code stop:worker2} for {@link ActionKind#INVOKE_CONTROL}, and an optional
 * note for {@link ActionKind#LOG_ONLY}.</p>
 */
public record Rule(
        String id,
        RuleMatch match,
        ActionKind action,
        String payload,
        Duration cooldown
) {
    public Rule {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(action, "action");
        payload = payload == null ? "" : payload;
        Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("Rule '" + id + "' has a negative cooldown");
        }
    }
}

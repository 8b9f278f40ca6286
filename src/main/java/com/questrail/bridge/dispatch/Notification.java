package com.questrail.bridge.dispatch;

import com.questrail.bridge.rules.Action;

import java.time.Instant;
import java.util.Objects;

/**
 * Message handed to a {@link Notifier}.
 */
public record Notification(
        String ruleId,
        String processName,
        String groupName,
        String eventName,
        String message,
        Instant timestamp
) {
    public Notification {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(processName, "processName");
        Objects.requireNonNull(groupName, "groupName");
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    static Notification of(Action action) {
        return new Notification(
                action.ruleId(),
                action.event().processName(),
                action.event().groupName(),
                action.event().eventName(),
                action.payload(),
                action.event().timestamp());
    }
}

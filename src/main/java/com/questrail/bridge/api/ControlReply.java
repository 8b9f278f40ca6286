package com.questrail.bridge.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a read-only control call that returns data.
 *
 * @param operation call that was made
 * @param outcome   classification of the result
 * @param value     returned data; present only when {@code outcome} is {@link ControlOutcome#OK}
 * @param message   detail for failed calls
 */
public record ControlReply<T>(
        ControlOperation operation,
        ControlOutcome outcome,
        Optional<T> value,
        String message
) {
    public ControlReply {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(value, "value");
        message = message == null ? "" : message;
    }

    public static <T> ControlReply<T> ok(ControlOperation operation, T value) {
        return new ControlReply<>(operation, ControlOutcome.OK, Optional.of(value), "");
    }

    public static <T> ControlReply<T> failed(ControlOperation operation, ControlOutcome outcome, String message) {
        if (outcome == ControlOutcome.OK) {
            throw new IllegalArgumentException("failed reply requires a failure outcome");
        }
        return new ControlReply<>(operation, outcome, Optional.empty(), message);
    }

    public boolean succeeded() {
        return outcome == ControlOutcome.OK;
    }
}

package com.questrail.bridge.api;

import java.util.Objects;

/**
 * Outcome of one mutating control command against one process.
 *
 * @param name      process the command targeted ({@code *} for daemon-wide commands)
 * @param operation command that was issued
 * @param outcome   classification of the result
 * @param message   human-readable detail, e.g. {@code worker1 state=RUNNING}
 */
public record ControlResult(
        String name,
        ControlOperation operation,
        ControlOutcome outcome,
        String message
) {
    /** Name used for results that are not about a single process. */
    public static final String ALL = "*";

    public ControlResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(outcome, "outcome");
        message = message == null ? "" : message;
    }

    public boolean succeeded() {
        return outcome == ControlOutcome.OK;
    }
}

package com.questrail.bridge.control;

import com.questrail.bridge.api.ControlOutcome;

import java.util.Objects;

/**
 * Failure of a single control call, already classified.
 *
 * <p>Never leaves {@link SupervisorControlClient}; callers see the outcome on a
 * {@link com.questrail.bridge.api.ControlResult} instead.</p>
 */
final class ControlCallException extends Exception
{
    static final int NO_FAULT = -1;

    private final ControlOutcome outcome;
    private final int faultCode;

    ControlCallException(ControlOutcome outcome, String message) {
        this(outcome, NO_FAULT, message, null);
    }

    ControlCallException(ControlOutcome outcome, int faultCode, String message, Throwable cause) {
        super(message, cause);
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.faultCode = faultCode;
    }

    ControlOutcome outcome() {
        return outcome;
    }

    int faultCode() {
        return faultCode;
    }
}

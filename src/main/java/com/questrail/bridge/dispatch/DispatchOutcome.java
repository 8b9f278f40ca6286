package com.questrail.bridge.dispatch;

import com.questrail.bridge.rules.Action;

import java.util.Objects;

/**
 * Result of executing one {@link Action}.
 *
 * @param action  the action that was executed
 * @param success whether the side effect took place
 * @param detail  short description of what happened
 */
public record DispatchOutcome(Action action, boolean success, String detail)
{
    public DispatchOutcome {
        Objects.requireNonNull(action, "action");
        detail = detail == null ? "" : detail;
    }

    public static DispatchOutcome succeeded(Action action, String detail) {
        return new DispatchOutcome(action, true, detail);
    }

    public static DispatchOutcome failed(Action action, String detail) {
        return new DispatchOutcome(action, false, detail);
    }
}

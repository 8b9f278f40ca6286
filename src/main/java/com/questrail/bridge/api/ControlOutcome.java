package com.questrail.bridge.api;

/**
 * Classification of a control call's result.
 *
 * <p>A management front end maps {@link #UNREACHABLE} to a service-unavailable
 * response and {@link #NOT_FOUND} to a not-found response; the two are never
 * conflated.</p>
 */
public enum ControlOutcome
{
    /** The daemon accepted the command and the process reached the expected state. */
    OK,

    /** The daemon does not know the process name. */
    NOT_FOUND,

    /** The daemon could not be reached, answered garbage, or did not answer in time. */
    UNREACHABLE,

    /** The daemon refused the command or the process ended up in the wrong state. */
    REJECTED
}

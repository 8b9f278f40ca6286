package com.questrail.bridge.protocol.listener.internal.decode;

/**
 * Indicates that a well-framed event could not be turned into a
 * {@link com.questrail.bridge.protocol.listener.model.SupervisorEvent}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A header without an {@code eventname}</li>
 *   <li>An unknown state suffix on a recognized event family</li>
 *   <li>A payload missing {@code processname} or {@code groupname}</li>
 * </ul>
 *
 * The failure is local to one event. The bridge loop logs it, acknowledges
 * the frame as {@code OK} and moves on.
 */
public final class EventDecodeException extends RuntimeException
{
    public EventDecodeException(String message) {
        super(message);
    }
}

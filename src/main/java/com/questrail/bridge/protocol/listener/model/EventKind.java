package com.questrail.bridge.protocol.listener.model;

/**
 * Classification of the lifecycle notifications the bridge understands.
 */
public enum EventKind
{
    /** {@code PROCESS_STATE_*}: a managed worker changed state. */
    PROCESS_STATE_CHANGED,

    /** {@code SUPERVISOR_STATE_CHANGE_*}: the daemon itself is starting or stopping. */
    SUPERVISOR_STATE_CHANGED
}

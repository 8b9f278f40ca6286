package com.questrail.bridge.api;

/**
 * Operations exposed by {@link ControlClient}.
 */
public enum ControlOperation
{
    LIST,
    INFO,
    START,
    STOP,
    RESTART,
    STOP_ALL,
    SHUTDOWN
}

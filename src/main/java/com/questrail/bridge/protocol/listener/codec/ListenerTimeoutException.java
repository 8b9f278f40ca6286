package com.questrail.bridge.protocol.listener.codec;

import java.io.InterruptedIOException;

/**
 * Raised when a configured idle-read timeout expires before the daemon
 * delivers the next header or the rest of a payload.
 */
public final class ListenerTimeoutException extends InterruptedIOException
{
    public ListenerTimeoutException(String message) {
        super(message);
    }
}

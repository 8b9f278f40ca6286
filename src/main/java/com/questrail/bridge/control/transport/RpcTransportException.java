package com.questrail.bridge.control.transport;

import java.io.IOException;

/**
 * The daemon could not be reached, or did not answer in time.
 */
public class RpcTransportException extends IOException
{
    private final boolean timedOut;

    public RpcTransportException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public RpcTransportException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean timedOut() {
        return timedOut;
    }
}

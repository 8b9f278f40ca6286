package com.questrail.bridge.protocol.listener.codec;

import java.io.IOException;

/**
 * Raised when the event stream violates the listener framing: a malformed
 * header line, or a missing or non-numeric {@code len}.
 *
 * <p>Framing errors are fatal to the bridge loop. Once the byte stream is out
 * of step there is no reliable way to find the next frame boundary.</p>
 */
public final class ListenerProtocolException extends IOException
{
    public ListenerProtocolException(String message) {
        super(message);
    }

    public ListenerProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

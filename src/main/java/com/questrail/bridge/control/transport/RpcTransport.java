package com.questrail.bridge.control.transport;

import java.io.Closeable;
import java.time.Duration;

/**
 * RpcTransport
 * -----------------------------------------------------------------------------
 * Port through which the control client posts one encoded request and waits for
 * the encoded reply.
 *
 * <p>Implementations move bytes only. They never interpret the body, never
 * retry, and never block longer than the timeout passed to {@link #call}.</p>
 */
public interface RpcTransport extends Closeable
{
    /**
     * Sends a request body and returns the reply body.
     *
     * @param body    encoded request
     * @param timeout upper bound for connect, send and receive together
     * @throws RpcTransportException if the endpoint cannot be reached, the
     *                               exchange times out or the reply is not
     *                               a success
     */
    byte[] call(byte[] body, Duration timeout) throws RpcTransportException;

    @Override
    void close();
}

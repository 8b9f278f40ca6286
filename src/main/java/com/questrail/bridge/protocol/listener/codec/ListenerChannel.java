package com.questrail.bridge.protocol.listener.codec;

import java.io.Closeable;
import java.io.IOException;

/**
 * ListenerChannel
 * -----------------------------------------------------------------------------
 * Duplex boundary to the daemon's event-listener protocol.
 *
 * <p>The daemon drives a strict request/acknowledge exchange over the
 * listener's standard input and output:</p>
 * <pre>
 *   listener: READY\n
 *   daemon:   &lt;header line&gt;\n&lt;len bytes of payload&gt;
 *   listener: RESULT 2\nOK            (or RESULT 4\nFAIL)
 *   listener: READY\n
 *   ...
 * </pre>
 *
 * <p>Exactly one frame is ever in flight. Implementations are responsible only
 * for framing; they do not interpret event names or payloads.</p>
 *
 * <p>Every write MUST be flushed before the method returns. The daemon blocks
 * on the exact bytes it expects, so a buffered acknowledgement stalls the
 * whole event pool.</p>
 */
public interface ListenerChannel extends Closeable
{
    /**
     * Signals readiness for the next event by writing {@code READY\n}.
     *
     * @throws IOException if the output side fails
     */
    void signalReady() throws IOException;

    /**
     * Blocks until one complete header line has been received.
     *
     * @return parsed header; never {@code null}
     * @throws ListenerProtocolException if the line is malformed or lacks a usable {@code len}
     * @throws ListenerTimeoutException  if an idle-read timeout is configured and expires
     * @throws java.io.EOFException      if the daemon closes the stream
     * @throws IOException               on any other transport failure
     */
    ListenerHeader readHeader() throws IOException;

    /**
     * Reads exactly {@code length} payload bytes.
     *
     * @param length byte count announced by the header's {@code len} key
     * @return payload bytes; empty for {@code length == 0}
     * @throws ListenerTimeoutException if an idle-read timeout is configured and expires
     * @throws java.io.EOFException     if the stream ends before {@code length} bytes arrive
     * @throws IOException              on any other transport failure
     */
    byte[] readPayload(int length) throws IOException;

    /**
     * Writes one acknowledgement for the frame just processed.
     *
     * @param result outcome to report to the daemon
     * @throws IOException if the output side fails
     */
    void acknowledge(ListenerResult result) throws IOException;

    /**
     * Releases any reader thread. The daemon owns the underlying streams, so
     * they are left open.
     */
    @Override
    void close();
}

package com.questrail.bridge.protocol.listener.codec.impl;

import com.questrail.bridge.protocol.listener.codec.ListenerProtocolException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * ListenerFraming
 * -----------------------------------------------------------------------------
 * Byte-level rules of the event-listener protocol.
 *
 * <ul>
 *   <li>The readiness token is the literal line {@code READY\n}.</li>
 *   <li>A frame is one header line terminated by {@code \n}, followed by
 *       exactly {@code len} payload bytes with no terminator.</li>
 * </ul>
 *
 * <p>This class locates line and payload boundaries only. Header tokens are
 * interpreted by {@link ListenerHeaderParser}.</p>
 */
final class ListenerFraming
{
    static final byte[] READY = "READY\n".getBytes(StandardCharsets.US_ASCII);

    static final int LINE_TERMINATOR = '\n';

    /** Header lines longer than this are treated as a desynchronized stream. */
    static final int MAX_HEADER_LINE = 8 * 1024;

    private ListenerFraming() {}

    /**
     * Reads one header line, excluding the terminator (and a trailing
     * {@code \r}, should one appear).
     *
     * @throws EOFException               if the stream ends before or inside the line
     * @throws ListenerProtocolException  if the line exceeds {@link #MAX_HEADER_LINE}
     */
    static String readLine(InputStream in) throws IOException
    {
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != LINE_TERMINATOR) {
            if (b < 0) {
                if (line.size() == 0) {
                    throw new EOFException("Event stream closed while awaiting header");
                }
                throw new EOFException("Event stream closed inside header line");
            }
            if (line.size() >= MAX_HEADER_LINE) {
                throw new ListenerProtocolException(
                        "Header line exceeds " + MAX_HEADER_LINE + " bytes");
            }
            line.write(b);
        }

        String text = line.toString(StandardCharsets.UTF_8);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws EOFException if fewer bytes are available before end of stream
     */
    static byte[] readExactly(InputStream in, int length) throws IOException
    {
        byte[] payload = in.readNBytes(length);
        if (payload.length != length) {
            throw new EOFException("Event stream closed after " + payload.length
                    + " of " + length + " payload bytes");
        }
        return payload;
    }
}

package com.questrail.bridge.protocol.listener.codec;

import java.nio.charset.StandardCharsets;

/**
 * Acknowledgement bodies understood by the daemon.
 *
 * <p>{@link #FAIL} asks the daemon to re-buffer the event; the bridge only
 * uses it when its own evaluation breaks, never for a malformed event.</p>
 */
public enum ListenerResult
{
    OK("OK"),
    FAIL("FAIL");

    private final String body;

    ListenerResult(String body) {
        this.body = body;
    }

    public String body() {
        return body;
    }

    /**
     * Complete acknowledgement as written on the wire:
     * {@code RESULT <n>\n<body>} with {@code n} the byte length of the body.
     */
    public byte[] encode() {
        byte[] bodyBytes = body.getBytes(StandardCharsets.US_ASCII);
        return ("RESULT " + bodyBytes.length + "\n" + body).getBytes(StandardCharsets.US_ASCII);
    }
}

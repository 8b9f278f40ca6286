package com.questrail.bridge.protocol.listener.codec.impl;

import com.questrail.bridge.protocol.listener.codec.ListenerHeader;
import com.questrail.bridge.protocol.listener.codec.ListenerProtocolException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses a header line of the form {@code key:value key:value ...}.
 *
 * <p>Tokens are separated by whitespace and split at their first colon, so
 * values may themselves contain colons. Every token must carry a non-empty
 * key; {@code len} must be present and a non-negative integer.</p>
 */
public final class ListenerHeaderParser
{
    private ListenerHeaderParser() {}

    public static ListenerHeader parse(String line) throws ListenerProtocolException
    {
        if (line == null || line.isBlank()) {
            throw new ListenerProtocolException("Empty header line");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (String token : line.trim().split("\\s+")) {
            int colon = token.indexOf(':');
            if (colon <= 0) {
                throw new ListenerProtocolException("Malformed header token '" + token + "'");
            }
            fields.put(token.substring(0, colon), token.substring(colon + 1));
        }

        String len = fields.get(ListenerHeader.KEY_LEN);
        if (len == null) {
            throw new ListenerProtocolException("Header has no 'len' key: " + line);
        }

        final int length;
        try {
            length = Integer.parseInt(len);
        } catch (NumberFormatException e) {
            throw new ListenerProtocolException("Non-numeric 'len' value '" + len + "'", e);
        }
        if (length < 0) {
            throw new ListenerProtocolException("Negative 'len' value " + length);
        }

        return new ListenerHeader(fields, length);
    }
}

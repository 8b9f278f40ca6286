package com.questrail.bridge.protocol.listener.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ListenerHeader
 * -----------------------------------------------------------------------------
 * Parsed header line of one event frame.
 *
 * <p>All {@code key:value} tokens are kept in arrival order, including keys
 * the bridge does not use. The recognized keys are exposed through typed
 * accessors.</p>
 *
 * @param fields every header token, in order
 * @param length payload byte count ({@code len}); validated non-negative at parse time
 */
public record ListenerHeader(Map<String, String> fields, int length)
{
    public static final String KEY_LEN = "len";
    public static final String KEY_VER = "ver";
    public static final String KEY_SERVER = "server";
    public static final String KEY_SERIAL = "serial";
    public static final String KEY_POOL = "pool";
    public static final String KEY_POOL_SERIAL = "poolserial";
    public static final String KEY_EVENT_NAME = "eventname";

    public ListenerHeader {
        Objects.requireNonNull(fields, "fields");
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<String> eventName() {
        return get(KEY_EVENT_NAME).filter(s -> !s.isBlank());
    }

    public Optional<String> version() {
        return get(KEY_VER);
    }

    public Optional<String> server() {
        return get(KEY_SERVER);
    }

    public Optional<String> serial() {
        return get(KEY_SERIAL);
    }

    public Optional<String> pool() {
        return get(KEY_POOL);
    }

    public Optional<String> poolSerial() {
        return get(KEY_POOL_SERIAL);
    }
}

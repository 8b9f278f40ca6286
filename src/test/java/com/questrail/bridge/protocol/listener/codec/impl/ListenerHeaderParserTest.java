package com.questrail.bridge.protocol.listener.codec.impl;

import com.questrail.bridge.protocol.listener.codec.ListenerHeader;
import com.questrail.bridge.protocol.listener.codec.ListenerProtocolException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ListenerHeaderParserTest {

    @Test
    void parsesTypicalDaemonHeader() throws Exception {
        ListenerHeader h = ListenerHeaderParser.parse(
                "ver:3.0 server:supervisor serial:21 pool:listener poolserial:10 eventname:PROCESS_STATE_FATAL len:54");

        assertEquals(54, h.length());
        assertEquals("PROCESS_STATE_FATAL", h.eventName().orElseThrow());
        assertEquals("3.0", h.version().orElseThrow());
        assertEquals("supervisor", h.server().orElseThrow());
        assertEquals("21", h.serial().orElseThrow());
        assertEquals("listener", h.pool().orElseThrow());
        assertEquals("10", h.poolSerial().orElseThrow());
    }

    @Test
    void keepsUnknownKeysAndSplitsAtFirstColon() throws Exception {
        ListenerHeader h = ListenerHeaderParser.parse("len:0 extra:a:b");

        assertEquals("a:b", h.get("extra").orElseThrow());
        assertEquals(0, h.length());
        assertTrue(h.eventName().isEmpty());
    }

    @Test
    void toleratesRepeatedWhitespace() throws Exception {
        ListenerHeader h = ListenerHeaderParser.parse("  eventname:TICK_5\t len:12  ");

        assertEquals(12, h.length());
        assertEquals("TICK_5", h.eventName().orElseThrow());
    }

    @Test
    void rejectsMissingLen() {
        assertThrows(ListenerProtocolException.class,
                () -> ListenerHeaderParser.parse("ver:3.0 eventname:PROCESS_STATE_RUNNING"));
    }

    @Test
    void rejectsNonNumericLen() {
        assertThrows(ListenerProtocolException.class, () -> ListenerHeaderParser.parse("len:abc"));
    }

    @Test
    void rejectsNegativeLen() {
        assertThrows(ListenerProtocolException.class, () -> ListenerHeaderParser.parse("len:-4"));
    }

    @Test
    void rejectsTokenWithoutColon() {
        assertThrows(ListenerProtocolException.class, () -> ListenerHeaderParser.parse("len:4 garbage"));
    }

    @Test
    void rejectsTokenWithEmptyKey() {
        assertThrows(ListenerProtocolException.class, () -> ListenerHeaderParser.parse("len:4 :value"));
    }

    @Test
    void rejectsBlankLine() {
        assertThrows(ListenerProtocolException.class, () -> ListenerHeaderParser.parse("   "));
    }
}

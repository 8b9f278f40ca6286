package com.questrail.bridge.protocol.listener.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorEventTest {

    @Test
    void describeUsesOperatorFormat() {
        SupervisorEvent e = TestEvents.process("worker1", "workers", ProcessState.BACKOFF, ProcessState.FATAL);
        assertEquals("[workers: worker1 (4242)] PROCESS_STATE_FATAL: BACKOFF -> FATAL", e.describe());
    }

    @Test
    void describeOmitsAbsentPieces() {
        SupervisorEvent e = SupervisorEvent.daemonStopping(Instant.EPOCH);
        assertEquals("[supervisord: supervisord] SUPERVISOR_STATE_CHANGE_STOPPING -> STOPPING", e.describe());
    }

    @Test
    void syntheticStoppingEventIsDaemonStopping() {
        assertTrue(SupervisorEvent.daemonStopping(Instant.EPOCH).isDaemonStopping());
        assertFalse(TestEvents.daemonRunning().isDaemonStopping());
        assertFalse(TestEvents.process("a", ProcessState.STOPPING).isDaemonStopping());
    }

    @Test
    void processStateTokensAndCodes() {
        assertEquals(ProcessState.FATAL, ProcessState.fromToken("fatal").orElseThrow());
        assertTrue(ProcessState.fromToken("nope").isEmpty());
        assertEquals(ProcessState.RUNNING, ProcessState.fromCode(20));
        assertEquals(ProcessState.UNKNOWN, ProcessState.fromCode(12345));
        assertTrue(ProcessState.STARTING.isActive());
        assertFalse(ProcessState.BACKOFF.isActive());
    }
}

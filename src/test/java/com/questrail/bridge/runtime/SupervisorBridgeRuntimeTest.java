package com.questrail.bridge.runtime;

import com.questrail.bridge.config.BridgeConfig;
import com.questrail.bridge.config.BridgeConfigLoader;
import com.questrail.bridge.control.transport.FakeRpcTransport;
import com.questrail.bridge.dispatch.DispatchOutcome;
import com.questrail.bridge.dispatch.Notification;
import com.questrail.bridge.dispatch.RecordingNotifier;
import com.questrail.bridge.observability.RecordingObservabilitySink;
import com.questrail.bridge.protocol.listener.internal.exec.ListenerBridgeLoop;
import com.questrail.bridge.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static com.questrail.bridge.control.xmlrpc.XmlRpcResponses.processInfo;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SupervisorBridgeRuntimeTest
 * -----------------------------------------------------------------------------
 * End-to-end: listener bytes in, control calls and notifications out.
 */
class SupervisorBridgeRuntimeTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static final String CONFIG = String.join("\n",
            "listener:",
            "  exitOnSupervisorStopping: true",
            "control:",
            "  stopAllExclusions: [bridge]",
            "defaults:",
            "  cooldownSeconds: 60",
            "rules:",
            "  - id: db-up-restart-api",
            "    match: {toStates: [RUNNING], processNames: [db]}",
            "    action: restart-dependent",
            "    payload: web:api",
            "  - id: worker-fatal",
            "    match: {toStates: [FATAL]}",
            "    action: notify",
            "    payload: \"{process} gave up\"",
            "  - id: on-stopping",
            "    match: {eventKinds: [supervisor], toStates: [STOPPING]}",
            "    action: invoke-control",
            "    payload: stopall",
            "    cooldownSeconds: 0",
            "");

    private final FakeRpcTransport transport = new FakeRpcTransport();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private static BridgeConfig config() {
        return BridgeConfigLoader.fromStream(new ByteArrayInputStream(CONFIG.getBytes(StandardCharsets.UTF_8)));
    }

    private static String frame(String eventName, String payload) {
        return "ver:3.0 server:supervisor serial:7 pool:bridge poolserial:7 eventname:" + eventName
                + " len:" + payload.getBytes(StandardCharsets.UTF_8).length + "\n" + payload;
    }

    private SupervisorBridgeRuntime runtime(String input) {
        return SupervisorBridgeRuntime.builder()
                .withConfig(config())
                .withInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)))
                .withOutput(out)
                .withTransport(transport)
                .withNotifier(notifier)
                .withObservabilitySink(sink)
                .withMonotonicClock(new ManualMonotonicClock())
                .withWallClock(() -> NOW)
                .build();
    }

    @Test
    void eventsDriveControlCallsAndNotificationsUntilDaemonStops() {
        transport.reply("supervisor.stopProcess", true)
                .reply("supervisor.startProcess", true)
                .reply("supervisor.getProcessInfo", processInfo("web", "api", "RUNNING", 300))
                .reply("supervisor.getProcessInfo", processInfo("web", "api", "STOPPED", 0))
                .reply("supervisor.getAllProcessInfo", List.of(
                        processInfo("web", "api", "RUNNING", 300),
                        processInfo("bridge", "bridge", "RUNNING", 301)))
                .reply("supervisor.getAllConfigInfo", List.of());

        String input = frame("PROCESS_STATE_RUNNING", "processname:db groupname:db from_state:STARTING pid:12")
                + frame("PROCESS_STATE_FATAL", "processname:worker1 groupname:workers from_state:BACKOFF")
                + frame("SUPERVISOR_STATE_CHANGE_STOPPING", "");

        int status;
        try (SupervisorBridgeRuntime runtime = runtime(input)) {
            status = runtime.run();
            assertTrue(runtime.handleShutdownSignal().isEmpty());
        }

        assertEquals(ListenerBridgeLoop.EXIT_NORMAL, status);
        assertEquals("READY\nRESULT 2\nOKREADY\nRESULT 2\nOKREADY\nRESULT 2\nOK",
                out.toString(StandardCharsets.US_ASCII));

        assertEquals(List.of("web:api", "web:api"),
                transport.callsTo("supervisor.stopProcess").stream().map(FakeRpcTransport.Call::target).toList());
        assertEquals(1, transport.callsTo("supervisor.startProcess").size());
        assertEquals(List.of("worker1 gave up"), notifier.sent().stream().map(Notification::message).toList());
        assertTrue(sink.getDispatchOutcomes().stream().allMatch(DispatchOutcome::success));
        assertTrue(transport.isClosed());
    }

    @Test
    void shutdownSignalRunsSyntheticStoppingOnce() {
        transport.reply("supervisor.getAllProcessInfo", List.of())
                .reply("supervisor.getAllConfigInfo", List.of());

        try (SupervisorBridgeRuntime runtime = runtime("")) {
            List<DispatchOutcome> first = runtime.handleShutdownSignal();
            List<DispatchOutcome> second = runtime.handleShutdownSignal();

            assertEquals(1, first.size());
            assertEquals("STOP_ALL: nothing to do", first.get(0).detail());
            assertTrue(second.isEmpty());
            assertEquals(1, transport.callsTo("supervisor.getAllProcessInfo").size());
        }
    }

    @Test
    void shutdownSignalAfterCloseDoesNothing() {
        SupervisorBridgeRuntime runtime = runtime("");
        runtime.close();

        assertTrue(runtime.handleShutdownSignal().isEmpty());
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void closedInputEndsWithIoError() {
        try (SupervisorBridgeRuntime runtime = runtime("")) {
            assertEquals(ListenerBridgeLoop.EXIT_IO_ERROR, runtime.run());
        }
        assertEquals("READY\n", out.toString(StandardCharsets.US_ASCII));
    }

    @Test
    void controlClientIsExposedForEmbedding() {
        transport.reply("supervisor.getAllProcessInfo", List.of(processInfo("web", "api", "RUNNING", 300)));

        try (SupervisorBridgeRuntime runtime = runtime("")) {
            assertEquals("web:api", runtime.controlClient().list().value().orElseThrow().get(0).name());
            assertEquals(3, runtime.ruleEngine().rules().size());
        }
    }
}

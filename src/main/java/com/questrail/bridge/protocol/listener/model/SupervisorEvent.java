package com.questrail.bridge.protocol.listener.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * SupervisorEvent
 * -----------------------------------------------------------------------------
 * Immutable, typed view of one lifecycle notification received from the daemon.
 *
 * <p>Created by the event decoder for each accepted frame, evaluated once by
 * the rule engine, then discarded. Nothing downstream mutates or stores it.</p>
 *
 * @param kind        process or daemon lifecycle change
 * @param eventName   raw event name from the frame header, e.g. {@code PROCESS_STATE_FATAL}
 * @param processName process name ({@code supervisord} for daemon events)
 * @param groupName   process group name ({@code supervisord} for daemon events)
 * @param fromState   previous state, when the payload carried a recognizable one
 * @param toState     new state, taken from the event name
 * @param pid         process id, when present and numeric
 * @param expected    for {@code EXITED}: whether the exit code was an expected one
 * @param timestamp   wall-clock time at which the event was decoded
 * @param fields      every {@code key:value} pair of the payload, verbatim
 * @param body        free text following the payload's blank line, or empty
 */
public record SupervisorEvent(
        EventKind kind,
        String eventName,
        String processName,
        String groupName,
        Optional<ProcessState> fromState,
        ProcessState toState,
        OptionalInt pid,
        Optional<Boolean> expected,
        Instant timestamp,
        Map<String, String> fields,
        String body
) {
    /** Process and group name carried by daemon-level events. */
    public static final String DAEMON_NAME = "supervisord";

    public SupervisorEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(processName, "processName");
        Objects.requireNonNull(groupName, "groupName");
        Objects.requireNonNull(fromState, "fromState");
        Objects.requireNonNull(toState, "toState");
        Objects.requireNonNull(pid, "pid");
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(timestamp, "timestamp");
        fields = Map.copyOf(Objects.requireNonNull(fields, "fields"));
        body = body == null ? "" : body;
    }

    /**
     * Builds the synthetic daemon-stopping event used when the bridge itself is
     * asked to terminate.
     */
    public static SupervisorEvent daemonStopping(Instant timestamp) {
        return new SupervisorEvent(
                EventKind.SUPERVISOR_STATE_CHANGED,
                "SUPERVISOR_STATE_CHANGE_STOPPING",
                DAEMON_NAME,
                DAEMON_NAME,
                Optional.empty(),
                ProcessState.STOPPING,
                OptionalInt.empty(),
                Optional.empty(),
                timestamp,
                Map.of(),
                "");
    }

    /** True if this is the daemon announcing its own shutdown. */
    public boolean isDaemonStopping() {
        return kind == EventKind.SUPERVISOR_STATE_CHANGED && toState == ProcessState.STOPPING;
    }

    /**
     * Renders the event in the operator log format:
     * {@code [group: process (pid)] EVENT: FROM -> TO: expected}.
     */
    public String describe() {
        StringBuilder who = new StringBuilder();
        if (!groupName.isBlank()) {
            who.append(groupName).append(": ");
        }
        who.append(processName);
        pid.ifPresent(p -> who.append(" (").append(p).append(')'));

        StringBuilder sb = new StringBuilder("[").append(who).append("] ").append(eventName);
        if (fromState.isPresent()) {
            sb.append(": ").append(fromState.get()).append(" -> ").append(toState);
        } else {
            sb.append(" -> ").append(toState);
        }
        expected.ifPresent(e -> sb.append(": ").append(e ? 1 : 0));
        return sb.toString();
    }
}

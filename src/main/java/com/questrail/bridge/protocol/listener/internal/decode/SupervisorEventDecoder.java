package com.questrail.bridge.protocol.listener.internal.decode;

import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.protocol.listener.codec.ListenerHeader;
import com.questrail.bridge.protocol.listener.model.EventKind;
import com.questrail.bridge.protocol.listener.model.ProcessState;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * SupervisorEventDecoder
 * ============================================================================
 * Converts a framed header and payload into a typed {@link SupervisorEvent}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between protocol mechanics (header tokens,
 * payload bytes) and the lifecycle vocabulary the rule engine reasons about.
 * Rules never look at raw header keys or payload text.
 *
 * <h2>Payload layout</h2>
 * <pre>
 *   processname:worker1 groupname:workers from_state:RUNNING pid:4242
 *   &lt;blank line&gt;
 *   optional free text
 * </pre>
 * Tokens without a colon are skipped, matching the daemon's own tolerance.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>{@code PROCESS_STATE_*} and {@code SUPERVISOR_STATE_CHANGE_*}: one event</li>
 *   <li>Any other event family: {@link Optional#empty()}</li>
 *   <li>Recognized family but unusable content: {@link EventDecodeException}</li>
 * </ul>
 *
 * Decoding has no side effects beyond reading the wall clock.
 */
public final class SupervisorEventDecoder
{
    static final String PROCESS_STATE_PREFIX = "PROCESS_STATE_";
    static final String SUPERVISOR_STATE_PREFIX = "SUPERVISOR_STATE_CHANGE_";

    static final String FIELD_PROCESS_NAME = "processname";
    static final String FIELD_GROUP_NAME = "groupname";
    static final String FIELD_FROM_STATE = "from_state";
    static final String FIELD_PID = "pid";
    static final String FIELD_EXPECTED = "expected";

    private static final Set<ProcessState> SUPERVISOR_STATES =
            EnumSet.of(ProcessState.RUNNING, ProcessState.STOPPING);

    private final WallClock wallClock;

    public SupervisorEventDecoder(WallClock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Decodes one frame.
     *
     * @param header  parsed header line
     * @param payload exactly {@code header.length()} bytes
     * @return the event, or empty if the event family is not one the bridge handles
     * @throws EventDecodeException if a handled event is malformed
     */
    public Optional<SupervisorEvent> decode(ListenerHeader header, byte[] payload)
    {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(payload, "payload");

        String eventName = header.eventName()
                .orElseThrow(() -> new EventDecodeException("Header carries no eventname"));

        if (eventName.startsWith(PROCESS_STATE_PREFIX)) {
            return Optional.of(decodeProcessEvent(eventName, payload));
        }
        if (eventName.startsWith(SUPERVISOR_STATE_PREFIX)) {
            return Optional.of(decodeSupervisorEvent(eventName, payload));
        }
        return Optional.empty();
    }

    private SupervisorEvent decodeProcessEvent(String eventName, byte[] payload)
    {
        String suffix = eventName.substring(PROCESS_STATE_PREFIX.length());
        ProcessState toState = ProcessState.fromToken(suffix)
                .filter(s -> suffix.equals(s.name()))
                .orElseThrow(() -> new EventDecodeException("Unknown process state in " + eventName));

        Payload p = Payload.parse(payload);
        String processName = require(p.fields(), FIELD_PROCESS_NAME, eventName);
        String groupName = require(p.fields(), FIELD_GROUP_NAME, eventName);

        return new SupervisorEvent(
                EventKind.PROCESS_STATE_CHANGED,
                eventName,
                processName,
                groupName,
                ProcessState.fromToken(p.fields().get(FIELD_FROM_STATE)),
                toState,
                parseInt(p.fields().get(FIELD_PID)),
                parseFlag(p.fields().get(FIELD_EXPECTED)),
                wallClock.now(),
                p.fields(),
                p.body());
    }

    private SupervisorEvent decodeSupervisorEvent(String eventName, byte[] payload)
    {
        String suffix = eventName.substring(SUPERVISOR_STATE_PREFIX.length());
        ProcessState toState = ProcessState.fromToken(suffix)
                .filter(s -> suffix.equals(s.name()))
                .filter(SUPERVISOR_STATES::contains)
                .orElseThrow(() -> new EventDecodeException("Unknown supervisor state in " + eventName));

        Payload p = Payload.parse(payload);

        return new SupervisorEvent(
                EventKind.SUPERVISOR_STATE_CHANGED,
                eventName,
                SupervisorEvent.DAEMON_NAME,
                SupervisorEvent.DAEMON_NAME,
                Optional.empty(),
                toState,
                OptionalInt.empty(),
                Optional.empty(),
                wallClock.now(),
                p.fields(),
                p.body());
    }

    private static String require(Map<String, String> fields, String key, String eventName)
    {
        String value = fields.get(key);
        if (value == null || value.isBlank()) {
            throw new EventDecodeException(eventName + " payload is missing '" + key + "'");
        }
        return value;
    }

    private static OptionalInt parseInt(String raw)
    {
        if (raw == null || raw.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static Optional<Boolean> parseFlag(String raw)
    {
        OptionalInt value = parseInt(raw);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return switch (value.getAsInt()) {
            case 0 -> Optional.of(Boolean.FALSE);
            case 1 -> Optional.of(Boolean.TRUE);
            default -> Optional.empty();
        };
    }

    /**
     * Token section and trailing body of a payload.
     */
    record Payload(Map<String, String> fields, String body)
    {
        static Payload parse(byte[] raw)
        {
            String text = new String(raw, StandardCharsets.UTF_8);

            String head = text;
            String body = "";
            int blank = text.indexOf("\n\n");
            if (blank >= 0) {
                head = text.substring(0, blank);
                body = text.substring(blank + 2);
            }

            Map<String, String> fields = new LinkedHashMap<>();
            for (String token : head.trim().split("\\s+")) {
                int colon = token.indexOf(':');
                if (colon > 0) {
                    fields.put(token.substring(0, colon), token.substring(colon + 1));
                }
            }
            return new Payload(fields, body);
        }
    }
}

package com.questrail.bridge.rules;

import com.questrail.bridge.protocol.listener.model.EventKind;
import com.questrail.bridge.protocol.listener.model.ProcessState;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RuleMatch
 * -----------------------------------------------------------------------------
 * Predicate half of a {@link Rule}.
 *
 * <p>An event matches when every configured filter accepts it. An empty set
 * accepts everything:</p>
 * <ul>
 *   <li>{@code toStates}: exact equality on the event's new state</li>
 *   <li>{@code processNames}: case-sensitive exact match on the process name</li>
 *   <li>{@code eventKinds}: process versus daemon events</li>
 *   <li>{@code expected}: if present, the event must carry the same exit expectation</li>
 * </ul>
 *
 * <p>{@link #test(SupervisorEvent)} is total: it never throws for a non-null event.</p>
 */
public record RuleMatch(
        Set<ProcessState> toStates,
        Set<String> processNames,
        Set<EventKind> eventKinds,
        Optional<Boolean> expected
) {
    public RuleMatch {
        toStates = Set.copyOf(Objects.requireNonNull(toStates, "toStates"));
        processNames = Set.copyOf(Objects.requireNonNull(processNames, "processNames"));
        eventKinds = Set.copyOf(Objects.requireNonNull(eventKinds, "eventKinds"));
        Objects.requireNonNull(expected, "expected");
    }

    /** Matches every event entering {@code state}, for any process. */
    public static RuleMatch toState(ProcessState state) {
        return new RuleMatch(Set.of(state), Set.of(), Set.of(), Optional.empty());
    }

    /** Same filter restricted to the given process names. */
    public RuleMatch forProcesses(Set<String> names) {
        return new RuleMatch(toStates, names, eventKinds, expected);
    }

    public boolean test(SupervisorEvent event) {
        if (!toStates.isEmpty() && !toStates.contains(event.toState())) {
            return false;
        }
        if (!processNames.isEmpty() && !processNames.contains(event.processName())) {
            return false;
        }
        if (!eventKinds.isEmpty() && !eventKinds.contains(event.kind())) {
            return false;
        }
        if (expected.isPresent()) {
            return event.expected().isPresent() && event.expected().get().equals(expected.get());
        }
        return true;
    }
}

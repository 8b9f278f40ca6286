package com.questrail.bridge.config;

import com.questrail.bridge.protocol.listener.model.EventKind;
import com.questrail.bridge.protocol.listener.model.ProcessState;
import com.questrail.bridge.rules.RuleMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@code match:} block of a rule. Omitted lists match anything.
 *
 * <p>{@code eventKinds} accepts {@code process}, {@code supervisor} or the
 * {@link EventKind} constant names.</p>
 */
public class MatchDefinition {

    private List<String> toStates = new ArrayList<>();
    private List<String> processNames = new ArrayList<>();
    private List<String> eventKinds = new ArrayList<>();
    private Boolean expected;

    /**
     * @param ruleId used in error messages
     * @return problems found; empty if the block is valid
     */
    List<String> problems(String ruleId) {
        List<String> errors = new ArrayList<>();
        for (String s : toStates) {
            if (ProcessState.fromToken(s).isEmpty()) {
                errors.add("Rule '" + ruleId + "' has unknown state '" + s + "'");
            }
        }
        for (String k : eventKinds) {
            if (parseKind(k).isEmpty()) {
                errors.add("Rule '" + ruleId + "' has unknown event kind '" + k + "'");
            }
        }
        for (String p : processNames) {
            if (p == null || p.isBlank()) {
                errors.add("Rule '" + ruleId + "' has a blank process name");
            }
        }
        return errors;
    }

    public RuleMatch toMatch() {
        Set<ProcessState> states = EnumSet.noneOf(ProcessState.class);
        toStates.forEach(s -> states.add(ProcessState.fromToken(s).orElseThrow()));
        Set<EventKind> kinds = EnumSet.noneOf(EventKind.class);
        eventKinds.forEach(k -> kinds.add(parseKind(k).orElseThrow()));
        Set<String> names = new LinkedHashSet<>();
        processNames.forEach(p -> names.add(p.trim()));
        return new RuleMatch(states, names, kinds, Optional.ofNullable(expected));
    }

    static Optional<EventKind> parseKind(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String k = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (k) {
            case "PROCESS":
                return Optional.of(EventKind.PROCESS_STATE_CHANGED);
            case "SUPERVISOR":
                return Optional.of(EventKind.SUPERVISOR_STATE_CHANGED);
            default:
                for (EventKind kind : EventKind.values()) {
                    if (kind.name().equals(k)) {
                        return Optional.of(kind);
                    }
                }
                return Optional.empty();
        }
    }

    public List<String> getToStates() {
        return Collections.unmodifiableList(toStates);
    }

    public void setToStates(List<String> toStates) {
        this.toStates = toStates != null ? new ArrayList<>(toStates) : new ArrayList<>();
    }

    public List<String> getProcessNames() {
        return Collections.unmodifiableList(processNames);
    }

    public void setProcessNames(List<String> processNames) {
        this.processNames = processNames != null ? new ArrayList<>(processNames) : new ArrayList<>();
    }

    public List<String> getEventKinds() {
        return Collections.unmodifiableList(eventKinds);
    }

    public void setEventKinds(List<String> eventKinds) {
        this.eventKinds = eventKinds != null ? new ArrayList<>(eventKinds) : new ArrayList<>();
    }

    public Boolean getExpected() {
        return expected;
    }

    public void setExpected(Boolean expected) {
        this.expected = expected;
    }
}

package com.questrail.bridge.rules;

import com.questrail.bridge.protocol.listener.model.SupervisorEvent;

import java.util.Objects;

/**
 * A single unit of dispatch work produced by the rule engine.
 *
 * <p>Consumed exactly once by the dispatcher. Retrying, where it happens at
 * all, belongs to the operation the dispatcher performs, never to this value.</p>
 *
 * @param kind          what to do
 * @param ruleId        rule that produced the action
 * @param targetProcess process the triggering event was about
 * @param payload       kind-specific argument (rendered message, dependent name, command)
 * @param event         the triggering event
 */
public record Action(
        ActionKind kind,
        String ruleId,
        String targetProcess,
        String payload,
        SupervisorEvent event
) {
    public Action {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(targetProcess, "targetProcess");
        payload = payload == null ? "" : payload;
        Objects.requireNonNull(event, "event");
    }
}

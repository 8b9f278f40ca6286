package com.questrail.bridge.rules;

import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * RuleEngine
 * -----------------------------------------------------------------------------
 * Deterministic evaluation of the static rule list against one event.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Rules are visited in declaration order and every rule is evaluated;
 *       a match never short-circuits the ones after it.</li>
 *   <li>A matching rule fires unless the same rule fired for the same process
 *       less than its cooldown ago. Suppression is per rule.</li>
 *   <li>Firing records the current monotonic tick for the pair.</li>
 *   <li>Emitted actions keep declaration order.</li>
 * </ul>
 *
 * <p>No I/O. The only mutation is the owned {@link CooldownState}. Not
 * thread-safe; the bridge loop serializes all calls.</p>
 */
public final class RuleEngine
{
    static final String DEFAULT_NOTIFY_TEMPLATE = "{process} ({group}) {from} -> {to} [{event}]";

    private final List<Rule> rules;
    private final MonotonicClock clock;
    private final CooldownState cooldowns = new CooldownState();

    /**
     * @throws IllegalArgumentException if two rules share an id
     */
    public RuleEngine(List<Rule> rules, MonotonicClock clock)
    {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.clock = Objects.requireNonNull(clock, "clock");

        Set<String> seen = new HashSet<>();
        for (Rule rule : this.rules) {
            if (!seen.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id '" + rule.id() + "'");
            }
        }
    }

    public List<Rule> rules()
    {
        return rules;
    }

    /**
     * Evaluates every rule against {@code event}.
     *
     * @return actions to dispatch, in rule order; empty if nothing fired
     */
    public List<Action> evaluate(SupervisorEvent event)
    {
        Objects.requireNonNull(event, "event");

        List<Action> actions = new ArrayList<>();
        for (Rule rule : rules) {
            if (!rule.match().test(event)) {
                continue;
            }

            long now = clock.nowNanos();
            if (cooldowns.isCoolingDown(rule.id(), event.processName(), rule.cooldown(), now)) {
                continue;
            }

            cooldowns.recordFire(rule.id(), event.processName(), now);
            actions.add(new Action(
                    rule.action(),
                    rule.id(),
                    event.processName(),
                    payloadFor(rule, event),
                    event));
        }
        return actions;
    }

    CooldownState cooldowns()
    {
        return cooldowns;
    }

    private static String payloadFor(Rule rule, SupervisorEvent event)
    {
        if (rule.action() != ActionKind.NOTIFY) {
            return rule.payload();
        }
        String template = rule.payload().isBlank() ? DEFAULT_NOTIFY_TEMPLATE : rule.payload();
        return render(template, event);
    }

    static String render(String template, SupervisorEvent event)
    {
        return template
                .replace("{process}", event.processName())
                .replace("{group}", event.groupName())
                .replace("{event}", event.eventName())
                .replace("{from}", event.fromState().map(Enum::name).orElse("?"))
                .replace("{to}", event.toState().name())
                .replace("{pid}", event.pid().isPresent() ? Integer.toString(event.pid().getAsInt()) : "-");
    }
}

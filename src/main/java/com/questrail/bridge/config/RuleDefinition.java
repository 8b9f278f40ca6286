package com.questrail.bridge.config;

import com.questrail.bridge.api.ControlCommand;
import com.questrail.bridge.rules.ActionKind;
import com.questrail.bridge.rules.Rule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the {@code rules:} list.
 *
 * <pre>
 * - id: worker-fatal
 *   match:
 *     toStates: [FATAL]
 *     processNames: [worker1]
 *   action: notify
 *   payload: "{process} entered {to}"
 *   cooldownSeconds: 60
 * </pre>
 *
 * <p>{@code cooldownSeconds} falls back to {@code defaults.cooldownSeconds}
 * when omitted.</p>
 */
public class RuleDefinition {

    private String id;
    private MatchDefinition match = new MatchDefinition();
    private String action;
    private String payload;
    private Integer cooldownSeconds;

    /**
     * Validate this rule.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = id == null || id.isBlank() ? "<unnamed>" : id;

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        errors.addAll(match.problems(label));

        ActionKind kind = null;
        try {
            kind = ActionKind.parse(action);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "': " + e.getMessage());
        }

        if (kind == ActionKind.RESTART_DEPENDENT && (payload == null || payload.isBlank())) {
            errors.add("Rule '" + label + "' restarts a dependent but 'payload' names no process");
        }
        if (kind == ActionKind.INVOKE_CONTROL) {
            try {
                ControlCommand.parse(payload == null ? "" : payload);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + label + "' has an invalid control command: " + e.getMessage());
            }
        }
        if (cooldownSeconds != null && cooldownSeconds < 0) {
            errors.add("Rule '" + label + "' requires 'cooldownSeconds' >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public Rule toRule(Duration defaultCooldown) {
        Objects.requireNonNull(defaultCooldown, "defaultCooldown");
        Duration cooldown = cooldownSeconds == null ? defaultCooldown : Duration.ofSeconds(cooldownSeconds);
        return new Rule(id.trim(), match.toMatch(), ActionKind.parse(action), payload, cooldown);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public MatchDefinition getMatch() {
        return match;
    }

    public void setMatch(MatchDefinition match) {
        this.match = match != null ? match : new MatchDefinition();
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public Integer getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(Integer cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "id='" + id + '\'' +
                ", action='" + action + '\'' +
                ", payload='" + payload + '\'' +
                ", cooldownSeconds=" + cooldownSeconds +
                '}';
    }
}

package com.questrail.bridge.config;

import com.questrail.bridge.rules.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the bridge YAML configuration.
 *
 * <pre>
 * listener:
 *   idleTimeoutSeconds: 0
 * control:
 *   url: http://127.0.0.1:9001/RPC2
 * notify:
 *   timeoutSeconds: 10
 * defaults:
 *   cooldownSeconds: 30
 * rules:
 *   - id: worker-fatal
 *     match: { toStates: [FATAL] }
 *     action: notify
 * </pre>
 *
 * <p>Call {@link #validate()} after loading; {@link BridgeConfigLoader} does.</p>
 */
public class BridgeConfig {

    private ListenerSection listener = new ListenerSection();
    private ControlSection control = new ControlSection();
    private NotifySection notify = new NotifySection();
    private DefaultsSection defaults = new DefaultsSection();
    private List<RuleDefinition> rules = new ArrayList<>();

    /**
     * Validate every section and rule, including rule id uniqueness.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        collect(errors, listener::validate);
        collect(errors, control::validate);
        collect(errors, notify::validate);
        collect(errors, defaults::validate);

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            collect(errors, rule::validate);
            if (rule.getId() != null && !rule.getId().isBlank() && !ids.add(rule.getId().trim())) {
                errors.add("Duplicate rule id '" + rule.getId().trim() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid bridge configuration: " + String.join("; ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable check) {
        try {
            check.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    /** Rules in declaration order. Requires a validated configuration. */
    public List<Rule> toRules() {
        List<Rule> out = new ArrayList<>(rules.size());
        for (RuleDefinition def : rules) {
            out.add(def.toRule(defaults.cooldown()));
        }
        return out;
    }

    public ListenerSection getListener() {
        return listener;
    }

    public void setListener(ListenerSection listener) {
        this.listener = listener != null ? listener : new ListenerSection();
    }

    public ControlSection getControl() {
        return control;
    }

    public void setControl(ControlSection control) {
        this.control = control != null ? control : new ControlSection();
    }

    public NotifySection getNotify() {
        return notify;
    }

    public void setNotify(NotifySection notify) {
        this.notify = notify != null ? notify : new NotifySection();
    }

    public DefaultsSection getDefaults() {
        return defaults;
    }

    public void setDefaults(DefaultsSection defaults) {
        this.defaults = defaults != null ? defaults : new DefaultsSection();
    }

    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }
}

package com.questrail.bridge.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code notify:} section. Without a command, notifications go to the log.
 *
 * <pre>
 * notify:
 *   command: [/usr/local/bin/page-oncall, --quiet]
 *   timeoutSeconds: 10
 * </pre>
 */
public class NotifySection {

    private List<String> command = new ArrayList<>();
    private int timeoutSeconds = 10;

    public void validate() {
        List<String> errors = new ArrayList<>();
        if (timeoutSeconds <= 0) {
            errors.add("notify.timeoutSeconds must be > 0");
        }
        if (!command.isEmpty() && (command.get(0) == null || command.get(0).isBlank())) {
            errors.add("notify.command must start with an executable");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public boolean hasCommand() {
        return !command.isEmpty();
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public List<String> getCommand() {
        return Collections.unmodifiableList(command);
    }

    public void setCommand(List<String> command) {
        this.command = command != null ? new ArrayList<>(command) : new ArrayList<>();
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}

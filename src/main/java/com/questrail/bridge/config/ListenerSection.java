package com.questrail.bridge.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code listener:} section.
 *
 * <pre>
 * listener:
 *   idleTimeoutSeconds: 0
 *   exitOnSupervisorStopping: true
 * </pre>
 */
public class ListenerSection {

    private int idleTimeoutSeconds = 0;
    private boolean exitOnSupervisorStopping = true;

    public void validate() {
        List<String> errors = new ArrayList<>();
        if (idleTimeoutSeconds < 0) {
            errors.add("listener.idleTimeoutSeconds must be >= 0");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public ListenerSettings toSettings() {
        return new ListenerSettings(Duration.ofSeconds(idleTimeoutSeconds), exitOnSupervisorStopping);
    }

    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public void setIdleTimeoutSeconds(int idleTimeoutSeconds) {
        this.idleTimeoutSeconds = idleTimeoutSeconds;
    }

    public boolean isExitOnSupervisorStopping() {
        return exitOnSupervisorStopping;
    }

    public void setExitOnSupervisorStopping(boolean exitOnSupervisorStopping) {
        this.exitOnSupervisorStopping = exitOnSupervisorStopping;
    }
}

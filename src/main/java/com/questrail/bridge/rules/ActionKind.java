package com.questrail.bridge.rules;

import java.util.Locale;

/**
 * The fixed set of reactions a rule may request.
 */
public enum ActionKind
{
    /** Hand a message to the notification collaborator. */
    NOTIFY,

    /** Restart the dependent process named in the rule payload. */
    RESTART_DEPENDENT,

    /** Record the event in the operational log only. */
    LOG_ONLY,

    /** Run the control command written in the rule payload. */
    INVOKE_CONTROL;

    /**
     * Lenient parse accepting {@code NOTIFY}, {@code notify},
     * {@code RestartDependent}, {@code restart-dependent} and similar spellings.
     *
     * @throws IllegalArgumentException if no kind matches
     */
    public static ActionKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Action kind is required");
        }
        String normalized = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action kind '" + raw + "'", e);
        }
    }
}

package com.questrail.bridge.protocol.listener.model;

import java.util.Locale;
import java.util.Optional;

/**
 * ProcessState
 * -----------------------------------------------------------------------------
 * Lifecycle states reported by supervisord for managed processes.
 *
 * <p>The numeric codes match the {@code state} field returned by the control
 * interface ({@code supervisor.getProcessInfo}); the names match both the
 * {@code statename} field and the suffix of {@code PROCESS_STATE_*} event
 * names. The daemon's own {@code SUPERVISOR_STATE_CHANGE_RUNNING} /
 * {@code _STOPPING} events reuse {@link #RUNNING} and {@link #STOPPING}.</p>
 */
public enum ProcessState
{
    STOPPED(0),
    STARTING(10),
    RUNNING(20),
    BACKOFF(30),
    STOPPING(40),
    EXITED(100),
    FATAL(200),
    UNKNOWN(1000);

    private final int code;

    ProcessState(int code) {
        this.code = code;
    }

    /** Numeric state code as reported over XML-RPC. */
    public int code() {
        return code;
    }

    /**
     * Parses a state token such as {@code RUNNING}. Matching is exact on the
     * upper-cased token; anything unrecognized yields {@link Optional#empty()}.
     */
    public static Optional<ProcessState> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(token.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Maps a numeric state code; unknown codes map to {@link #UNKNOWN}. */
    public static ProcessState fromCode(int code) {
        for (ProcessState s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        return UNKNOWN;
    }

    /** True for states in which a stop request is meaningful. */
    public boolean isActive() {
        return this == RUNNING || this == STARTING;
    }
}

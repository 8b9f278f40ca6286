package com.questrail.bridge.api;

import com.questrail.bridge.protocol.listener.model.ProcessState;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One row of a process listing.
 *
 * @param name  fully qualified name, {@code group:name}, accepted by every control command
 * @param group program group
 * @param state current lifecycle state
 * @param pid   process id while the process is alive
 */
public record ProcessStatus(String name, String group, ProcessState state, OptionalInt pid)
{
    public ProcessStatus {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(pid, "pid");
    }

    /** Name without the {@code group:} prefix. */
    public String shortName() {
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }
}

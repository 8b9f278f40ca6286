package com.questrail.bridge.api;

import com.questrail.bridge.protocol.listener.model.ProcessState;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Full process record as returned by {@code supervisor.getProcessInfo}.
 *
 * <p>Epoch fields are seconds; zero means "never".</p>
 */
public record ProcessDetails(
        String name,
        String group,
        ProcessState state,
        OptionalInt pid,
        String description,
        long startEpoch,
        long stopEpoch,
        long nowEpoch,
        int exitStatus,
        String spawnError,
        String stdoutLogfile,
        String stderrLogfile
) {
    public ProcessDetails {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(pid, "pid");
        description = description == null ? "" : description;
        spawnError = spawnError == null ? "" : spawnError;
        stdoutLogfile = stdoutLogfile == null ? "" : stdoutLogfile;
        stderrLogfile = stderrLogfile == null ? "" : stderrLogfile;
    }
}

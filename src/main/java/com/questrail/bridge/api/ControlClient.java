package com.questrail.bridge.api;

import java.util.List;

/**
 * ControlClient
 * =============================================================================
 * Library-level control surface of the process-supervision daemon.
 *
 * <h2>Callers</h2>
 * Two origins share one instance: the action dispatcher reacting to events,
 * and an operator-facing management API embedding this library.
 * Implementations MUST therefore be safe for concurrent use.
 *
 * <h2>Failure contract</h2>
 * No method throws for daemon-side or transport failures. Every outcome,
 * including an unreachable daemon or a timeout, comes back as a
 * {@link ControlOutcome} inside the returned value.
 *
 * <h2>Timeouts</h2>
 * Every call is bounded by the implementation's configured per-call timeout.
 * Composite operations ({@link #restart}, {@link #stopAll}) apply it to each
 * underlying daemon call.
 */
public interface ControlClient
{
    /** Lists every managed process with its state and pid. */
    ControlReply<List<ProcessStatus>> list();

    /** Returns the full record of one process. */
    ControlReply<ProcessDetails> info(String name);

    ControlResult start(String name);

    ControlResult stop(String name);

    /**
     * Stops then starts {@code name}. The start is attempted only if the stop
     * succeeded or the process was already stopped; otherwise the stop failure
     * is reported and nothing else is sent.
     */
    ControlResult restart(String name);

    /**
     * Stops every running process, one at a time. A failure on one process
     * does not prevent the others from being stopped.
     *
     * @return one result per process a stop was attempted for; empty when nothing was running
     */
    List<ControlResult> stopAll();

    /** Asks the daemon itself to shut down. */
    ControlResult shutdown();

    /**
     * Runs a command value. Read-only commands report their outcome without
     * the data they fetched.
     *
     * @return one result per affected process ({@link #stopAll()} may yield several)
     */
    default List<ControlResult> execute(ControlCommand command) {
        if (command instanceof ControlCommand.ListProcesses) {
            ControlReply<List<ProcessStatus>> reply = list();
            String message = reply.value().map(l -> l.size() + " process(es)").orElse(reply.message());
            return List.of(new ControlResult(ControlResult.ALL, ControlOperation.LIST, reply.outcome(), message));
        }
        if (command instanceof ControlCommand.Info c) {
            ControlReply<ProcessDetails> reply = info(c.name());
            String message = reply.value().map(d -> c.name() + " state=" + d.state()).orElse(reply.message());
            return List.of(new ControlResult(c.name(), ControlOperation.INFO, reply.outcome(), message));
        }
        if (command instanceof ControlCommand.Start c) {
            return List.of(start(c.name()));
        }
        if (command instanceof ControlCommand.Stop c) {
            return List.of(stop(c.name()));
        }
        if (command instanceof ControlCommand.Restart c) {
            return List.of(restart(c.name()));
        }
        if (command instanceof ControlCommand.StopAll) {
            return stopAll();
        }
        if (command instanceof ControlCommand.Shutdown) {
            return List.of(shutdown());
        }
        throw new IllegalArgumentException("Unsupported command " + command);
    }
}

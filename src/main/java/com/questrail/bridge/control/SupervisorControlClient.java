package com.questrail.bridge.control;

import com.questrail.bridge.api.ControlClient;
import com.questrail.bridge.api.ControlOperation;
import com.questrail.bridge.api.ControlOutcome;
import com.questrail.bridge.api.ControlReply;
import com.questrail.bridge.api.ControlResult;
import com.questrail.bridge.api.ProcessDetails;
import com.questrail.bridge.api.ProcessStatus;
import com.questrail.bridge.control.transport.RpcTransport;
import com.questrail.bridge.control.transport.RpcTransportException;
import com.questrail.bridge.control.xmlrpc.XmlRpcCodec;
import com.questrail.bridge.control.xmlrpc.XmlRpcFault;
import com.questrail.bridge.control.xmlrpc.XmlRpcFormatException;
import com.questrail.bridge.protocol.listener.model.ProcessState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * SupervisorControlClient
 * =============================================================================
 * {@link ControlClient} backed by the daemon's XML-RPC interface.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Encode each command as one or more {@code supervisor.*} calls</li>
 *   <li>Classify every failure into a {@link ControlOutcome}</li>
 *   <li>Verify the post-state of start and stop with {@code getProcessInfo}</li>
 * </ul>
 *
 * <h2>Fault classification</h2>
 * <ul>
 *   <li>{@code BAD_NAME} fault: {@link ControlOutcome#NOT_FOUND}</li>
 *   <li>any other fault: {@link ControlOutcome#REJECTED}</li>
 *   <li>transport failure, HTTP error, malformed reply, timeout:
 *       {@link ControlOutcome#UNREACHABLE}</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * At most one call is in flight. Callers queue on a fair lock, and time spent
 * queued counts against the call timeout. No method throws for a daemon-side
 * failure.
 */
public final class SupervisorControlClient implements ControlClient
{
    private static final Logger log = LoggerFactory.getLogger(SupervisorControlClient.class);

    static final int DEFAULT_PRIORITY = 9999;

    private static final Set<ProcessState> STARTED_STATES = EnumSet.of(ProcessState.STARTING, ProcessState.RUNNING);
    private static final Set<ProcessState> STOPPED_STATES = EnumSet.of(
            ProcessState.STOPPED, ProcessState.EXITED, ProcessState.FATAL, ProcessState.STOPPING);

    private final RpcTransport transport;
    private final ControlTimingPolicy timing;
    private final Set<String> stopAllExclusions;
    private final ReentrantLock callLock = new ReentrantLock(true);

    public SupervisorControlClient(RpcTransport transport, ControlTimingPolicy timing)
    {
        this(transport, timing, List.of());
    }

    /**
     * @param stopAllExclusions process names {@link #stopAll()} never stops;
     *                          matched case-insensitively against the full
     *                          {@code group:name} or the bare name
     */
    public SupervisorControlClient(RpcTransport transport,
                                   ControlTimingPolicy timing,
                                   Collection<String> stopAllExclusions)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.stopAllExclusions = Objects.requireNonNull(stopAllExclusions, "stopAllExclusions").stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .filter(n -> !n.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public ControlTimingPolicy timing()
    {
        return timing;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    @Override
    public ControlReply<List<ProcessStatus>> list()
    {
        try {
            return ControlReply.ok(ControlOperation.LIST, fetchAll());
        } catch (ControlCallException e) {
            log.warn("Listing processes failed: {} ({})", e.getMessage(), e.outcome());
            return ControlReply.failed(ControlOperation.LIST, e.outcome(), e.getMessage());
        }
    }

    @Override
    public ControlReply<ProcessDetails> info(String name)
    {
        Objects.requireNonNull(name, "name");
        try {
            Map<?, ?> row = asStruct(invoke("supervisor.getProcessInfo", name));
            return ControlReply.ok(ControlOperation.INFO, toDetails(row));
        } catch (ControlCallException e) {
            log.warn("Process info for {} failed: {} ({})", name, e.getMessage(), e.outcome());
            return ControlReply.failed(ControlOperation.INFO, e.outcome(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    @Override
    public ControlResult start(String name)
    {
        Objects.requireNonNull(name, "name");
        try {
            invoke("supervisor.startProcess", name);
        } catch (ControlCallException e) {
            return failure(name, ControlOperation.START, e);
        }
        return verify(name, ControlOperation.START, STARTED_STATES);
    }

    @Override
    public ControlResult stop(String name)
    {
        Objects.requireNonNull(name, "name");
        try {
            invoke("supervisor.stopProcess", name);
        } catch (ControlCallException e) {
            return failure(name, ControlOperation.STOP, e);
        }
        return verify(name, ControlOperation.STOP, STOPPED_STATES);
    }

    /**
     * Stops then starts {@code name}. The start is attempted only when the
     * stop succeeded or the daemon reported the process as not running.
     */
    @Override
    public ControlResult restart(String name)
    {
        Objects.requireNonNull(name, "name");
        try {
            invoke("supervisor.stopProcess", name);
        } catch (ControlCallException e) {
            if (e.faultCode() != XmlRpcFault.NOT_RUNNING) {
                return failure(name, ControlOperation.RESTART, e, "stop failed: ");
            }
            log.debug("{} was not running; starting it", name);
        }

        ControlResult started = start(name);
        return new ControlResult(name, ControlOperation.RESTART, started.outcome(), started.message());
    }

    /**
     * Stops every running or starting process that is not excluded, highest
     * configured priority first.
     *
     * @return one result per attempted process, or a single
     *         {@link ControlResult#ALL} result if the listing failed
     */
    @Override
    public List<ControlResult> stopAll()
    {
        List<ProcessStatus> processes;
        try {
            processes = fetchAll();
        } catch (ControlCallException e) {
            log.warn("Stop-all aborted, listing failed: {} ({})", e.getMessage(), e.outcome());
            return List.of(new ControlResult(ControlResult.ALL, ControlOperation.STOP_ALL, e.outcome(), e.getMessage()));
        }

        Map<String, Integer> priorities = fetchPriorities();
        List<ProcessStatus> targets = processes.stream()
                .filter(p -> p.state().isActive())
                .filter(p -> !isExcluded(p))
                .sorted(Comparator
                        .comparingInt((ProcessStatus p) -> priorities.getOrDefault(p.name(), DEFAULT_PRIORITY))
                        .reversed()
                        .thenComparing(ProcessStatus::name))
                .toList();

        List<ControlResult> results = new ArrayList<>(targets.size());
        for (ProcessStatus p : targets) {
            ControlResult r = stop(p.name());
            results.add(new ControlResult(p.name(), ControlOperation.STOP_ALL, r.outcome(), r.message()));
        }
        log.info("Stop-all attempted {} process(es), {} failed",
                results.size(), results.stream().filter(r -> !r.succeeded()).count());
        return results;
    }

    @Override
    public ControlResult shutdown()
    {
        try {
            invoke("supervisor.shutdown");
        } catch (ControlCallException e) {
            return failure(ControlResult.ALL, ControlOperation.SHUTDOWN, e);
        }
        log.info("Daemon shutdown requested");
        return new ControlResult(ControlResult.ALL, ControlOperation.SHUTDOWN, ControlOutcome.OK, "shutdown requested");
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private List<ProcessStatus> fetchAll() throws ControlCallException
    {
        Object raw = invoke("supervisor.getAllProcessInfo");
        if (!(raw instanceof List<?> rows)) {
            throw new ControlCallException(ControlOutcome.UNREACHABLE, "getAllProcessInfo did not return an array");
        }
        List<ProcessStatus> out = new ArrayList<>(rows.size());
        for (Object row : rows) {
            Map<?, ?> s = asStruct(row);
            String group = text(s, "group");
            out.add(new ProcessStatus(fullName(s), group, stateOf(s), pidOf(s)));
        }
        return out;
    }

    /** Priorities keyed by full name; empty when the daemon cannot report them. */
    private Map<String, Integer> fetchPriorities()
    {
        Object raw;
        try {
            raw = invoke("supervisor.getAllConfigInfo");
        } catch (ControlCallException e) {
            log.debug("Process priorities unavailable, stopping in name order: {}", e.getMessage());
            return Map.of();
        }

        Map<String, Integer> priorities = new HashMap<>();
        if (raw instanceof List<?> rows) {
            for (Object row : rows) {
                if (row instanceof Map<?, ?> m && m.get("priority") instanceof Number n) {
                    priorities.put(fullName(m), n.intValue());
                }
            }
        }
        return priorities;
    }

    private boolean isExcluded(ProcessStatus p)
    {
        return stopAllExclusions.contains(p.name().toLowerCase(Locale.ROOT))
                || stopAllExclusions.contains(p.shortName().toLowerCase(Locale.ROOT));
    }

    private ControlResult verify(String name, ControlOperation operation, Set<ProcessState> accepted)
    {
        Map<?, ?> row;
        try {
            row = asStruct(invoke("supervisor.getProcessInfo", name));
        } catch (ControlCallException e) {
            return failure(name, operation, e, "post-state check failed: ");
        }

        ProcessState state = stateOf(row);
        String message = name + " state=" + state;
        if (!accepted.contains(state)) {
            log.warn("{} {} did not take effect: {}", operation, name, message);
            return new ControlResult(name, operation, ControlOutcome.REJECTED, message);
        }
        log.info("{} {} ok: {}", operation, name, message);
        return new ControlResult(name, operation, ControlOutcome.OK, message);
    }

    private ControlResult failure(String name, ControlOperation operation, ControlCallException e)
    {
        return failure(name, operation, e, "");
    }

    private ControlResult failure(String name, ControlOperation operation, ControlCallException e, String prefix)
    {
        log.warn("{} {} failed: {} ({})", operation, name, e.getMessage(), e.outcome());
        return new ControlResult(name, operation, e.outcome(), prefix + e.getMessage());
    }

    /**
     * Performs one XML-RPC call under the call lock, classifying failures.
     */
    Object invoke(String method, Object... params) throws ControlCallException
    {
        Duration timeout = timing.callTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();

        boolean locked;
        try {
            locked = callLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlCallException(ControlOutcome.UNREACHABLE, ControlCallException.NO_FAULT, "interrupted waiting to call " + method, e);
        }
        if (!locked) {
            throw new ControlCallException(ControlOutcome.UNREACHABLE,
                    "timed out after " + timeout.toMillis() + " ms waiting to call " + method);
        }

        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new ControlCallException(ControlOutcome.UNREACHABLE,
                        "timed out after " + timeout.toMillis() + " ms waiting to call " + method);
            }
            byte[] request = XmlRpcCodec.encodeCall(method, List.of(params));
            byte[] reply = transport.call(request, Duration.ofNanos(remaining));
            return XmlRpcCodec.decodeResponse(reply);
        } catch (XmlRpcFault f) {
            ControlOutcome outcome = f.faultCode() == XmlRpcFault.BAD_NAME
                    ? ControlOutcome.NOT_FOUND
                    : ControlOutcome.REJECTED;
            throw new ControlCallException(outcome, f.faultCode(), f.faultString(), f);
        } catch (XmlRpcFormatException e) {
            throw new ControlCallException(ControlOutcome.UNREACHABLE, ControlCallException.NO_FAULT,
                    method + ": malformed reply: " + e.getMessage(), e);
        } catch (RpcTransportException e) {
            throw new ControlCallException(ControlOutcome.UNREACHABLE, ControlCallException.NO_FAULT,
                    method + ": " + e.getMessage(), e);
        } finally {
            callLock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Row mapping
    // ---------------------------------------------------------------------

    private static Map<?, ?> asStruct(Object raw) throws ControlCallException
    {
        if (!(raw instanceof Map<?, ?> struct)) {
            throw new ControlCallException(ControlOutcome.UNREACHABLE, "expected a struct in the reply");
        }
        return struct;
    }

    static String fullName(Map<?, ?> row)
    {
        String name = text(row, "name");
        String group = text(row, "group");
        return group.isEmpty() ? name : group + ":" + name;
    }

    private static ProcessState stateOf(Map<?, ?> row)
    {
        return ProcessState.fromToken(text(row, "statename"))
                .orElseGet(() -> row.get("state") instanceof Number n
                        ? ProcessState.fromCode(n.intValue())
                        : ProcessState.UNKNOWN);
    }

    private static OptionalInt pidOf(Map<?, ?> row)
    {
        int pid = number(row, "pid");
        return pid > 0 ? OptionalInt.of(pid) : OptionalInt.empty();
    }

    private static ProcessDetails toDetails(Map<?, ?> row)
    {
        return new ProcessDetails(
                fullName(row),
                text(row, "group"),
                stateOf(row),
                pidOf(row),
                text(row, "description"),
                number(row, "start"),
                number(row, "stop"),
                number(row, "now"),
                number(row, "exitstatus"),
                text(row, "spawnerr"),
                text(row, "stdout_logfile"),
                text(row, "stderr_logfile"));
    }

    private static String text(Map<?, ?> row, String key)
    {
        Object v = row.get(key);
        return v == null ? "" : v.toString().trim();
    }

    private static int number(Map<?, ?> row, String key)
    {
        return row.get(key) instanceof Number n ? n.intValue() : 0;
    }
}

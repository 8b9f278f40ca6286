package com.questrail.bridge.protocol.listener.internal.exec;

import com.questrail.bridge.dispatch.ActionDispatcher;
import com.questrail.bridge.dispatch.DispatchOutcome;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.BridgePhaseTransitionEvent;
import com.questrail.bridge.observability.NullObservabilitySink;
import com.questrail.bridge.protocol.listener.codec.ListenerChannel;
import com.questrail.bridge.protocol.listener.codec.ListenerHeader;
import com.questrail.bridge.protocol.listener.codec.ListenerProtocolException;
import com.questrail.bridge.protocol.listener.codec.ListenerResult;
import com.questrail.bridge.protocol.listener.codec.ListenerTimeoutException;
import com.questrail.bridge.protocol.listener.internal.decode.EventDecodeException;
import com.questrail.bridge.protocol.listener.internal.decode.SupervisorEventDecoder;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;
import com.questrail.bridge.rules.Action;
import com.questrail.bridge.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ListenerBridgeLoop
 * =============================================================================
 * Drives the event-listener protocol: one event per cycle, strictly
 * request/acknowledge.
 *
 * <h2>Cycle</h2>
 * <ol>
 *   <li>Write {@code READY}.</li>
 *   <li>Read the header line and exactly {@code len} payload bytes.</li>
 *   <li>Decode. An undecodable or uninteresting event is acknowledged
 *       {@code OK} without evaluation.</li>
 *   <li>Evaluate rules and dispatch the resulting actions in order.</li>
 *   <li>Acknowledge: {@code OK}, or {@code FAIL} when evaluation or dispatch
 *       threw unexpectedly. The daemon re-sends a {@code FAIL}ed event.</li>
 * </ol>
 *
 * <h2>Termination</h2>
 * The loop ends when the channel fails ({@link #EXIT_PROTOCOL_ERROR},
 * {@link #EXIT_IO_ERROR}, {@link #EXIT_IDLE_TIMEOUT}) or, when configured, after
 * acknowledging the daemon's own {@code STOPPING} event ({@link #EXIT_NORMAL}).
 * A failed acknowledgement is never retried.
 *
 * <h2>Threading</h2>
 * {@link #run()} owns the channel and must be called from one thread.
 * {@link #processSyntheticEvent} may be called from any other thread; it is
 * serialized with the loop's evaluation and dispatch through a shared lock but
 * never touches the channel or the phase.
 */
public final class ListenerBridgeLoop
{
    private static final Logger log = LoggerFactory.getLogger(ListenerBridgeLoop.class);

    public static final int EXIT_NORMAL = 0;
    public static final int EXIT_PROTOCOL_ERROR = 1;
    public static final int EXIT_IO_ERROR = 2;
    public static final int EXIT_IDLE_TIMEOUT = 3;

    private final ListenerChannel channel;
    private final SupervisorEventDecoder decoder;
    private final RuleEngine engine;
    private final ActionDispatcher dispatcher;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;
    private final boolean exitOnSupervisorStopping;

    private final ReentrantLock processingLock = new ReentrantLock();

    private volatile BridgePhase phase = BridgePhase.AWAITING_EVENT;

    public ListenerBridgeLoop(ListenerChannel channel,
                              SupervisorEventDecoder decoder,
                              RuleEngine engine,
                              ActionDispatcher dispatcher,
                              BridgeObservabilitySink sink,
                              WallClock wallClock,
                              boolean exitOnSupervisorStopping)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.exitOnSupervisorStopping = exitOnSupervisorStopping;
    }

    public BridgePhase phase()
    {
        return phase;
    }

    /**
     * Runs cycles until the loop terminates.
     *
     * @return the process exit status
     */
    public int run()
    {
        log.info("Listener loop started");
        while (true) {
            OptionalInt exit = runCycle();
            if (exit.isPresent()) {
                return exit.getAsInt();
            }
        }
    }

    /**
     * Runs exactly one READY-to-RESULT cycle.
     *
     * @return the exit status if the loop terminated during this cycle,
     *         otherwise empty
     * @throws IllegalStateException if the loop has already stopped
     */
    public OptionalInt runCycle()
    {
        if (phase != BridgePhase.AWAITING_EVENT) {
            throw new IllegalStateException("Cannot start a cycle in phase " + phase);
        }

        try {
            channel.signalReady();

            transition(BridgePhase.READING_HEADER);
            ListenerHeader header = channel.readHeader();

            transition(BridgePhase.READING_PAYLOAD);
            byte[] payload = channel.readPayload(header.length());

            transition(BridgePhase.DECODING);
            Optional<SupervisorEvent> decoded = decode(header, payload);

            ListenerResult result = ListenerResult.OK;
            boolean stopAfterAck = false;
            if (decoded.isPresent()) {
                SupervisorEvent event = decoded.get();
                sink.onEventReceived(event);
                transition(BridgePhase.EVALUATING);
                result = evaluateAndDispatch(event);
                stopAfterAck = exitOnSupervisorStopping && event.isDaemonStopping();
            }

            transition(BridgePhase.ACKNOWLEDGING);
            channel.acknowledge(result);

            if (stopAfterAck) {
                log.info("Daemon is stopping; listener exits");
                transition(BridgePhase.STOPPED);
                return OptionalInt.of(EXIT_NORMAL);
            }
            transition(BridgePhase.AWAITING_EVENT);
            return OptionalInt.empty();
        } catch (ListenerProtocolException e) {
            return terminate(EXIT_PROTOCOL_ERROR, "Listener protocol violation in phase " + phase, e);
        } catch (ListenerTimeoutException e) {
            return terminate(EXIT_IDLE_TIMEOUT, "No data from the daemon in phase " + phase, e);
        } catch (EOFException e) {
            return terminate(EXIT_IO_ERROR, "Listener input closed in phase " + phase, null);
        } catch (IOException e) {
            return terminate(EXIT_IO_ERROR, "Listener I/O failure in phase " + phase, e);
        }
    }

    /**
     * Evaluates and dispatches an event that did not arrive on the channel,
     * e.g. a {@code STOPPING} event raised locally at process shutdown.
     *
     * @return the dispatch outcomes; empty if no rule fired or evaluation failed
     */
    public List<DispatchOutcome> processSyntheticEvent(SupervisorEvent event)
    {
        Objects.requireNonNull(event, "event");
        sink.onEventReceived(event);
        processingLock.lock();
        try {
            List<Action> actions = engine.evaluate(event);
            List<DispatchOutcome> outcomes = dispatcher.dispatchAll(actions);
            outcomes.forEach(sink::onDispatchOutcome);
            return outcomes;
        } catch (RuntimeException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(), "Processing synthetic " + event.eventName() + " failed", e));
            return List.of();
        } finally {
            processingLock.unlock();
        }
    }

    private Optional<SupervisorEvent> decode(ListenerHeader header, byte[] payload)
    {
        try {
            Optional<SupervisorEvent> event = decoder.decode(header, payload);
            if (event.isEmpty()) {
                log.debug("Ignoring event {}", header.eventName().orElse("?"));
            }
            return event;
        } catch (EventDecodeException e) {
            sink.onError(new BridgeErrorEvent(wallClock.now(), "Undecodable event, acknowledging anyway: " + e.getMessage(), null));
            return Optional.empty();
        }
    }

    private ListenerResult evaluateAndDispatch(SupervisorEvent event)
    {
        processingLock.lock();
        try {
            List<Action> actions;
            try {
                actions = engine.evaluate(event);
            } catch (RuntimeException e) {
                sink.onError(new BridgeErrorEvent(wallClock.now(), "Rule evaluation failed for " + event.eventName(), e));
                return ListenerResult.FAIL;
            }
            if (actions.isEmpty()) {
                return ListenerResult.OK;
            }

            transition(BridgePhase.DISPATCHING);
            List<DispatchOutcome> outcomes;
            try {
                outcomes = dispatcher.dispatchAll(actions);
            } catch (RuntimeException e) {
                sink.onError(new BridgeErrorEvent(wallClock.now(), "Dispatch failed for " + event.eventName(), e));
                return ListenerResult.FAIL;
            }
            outcomes.forEach(sink::onDispatchOutcome);
            return ListenerResult.OK;
        } finally {
            processingLock.unlock();
        }
    }

    private OptionalInt terminate(int status, String message, Throwable cause)
    {
        sink.onError(new BridgeErrorEvent(wallClock.now(), message, cause));
        transition(BridgePhase.STOPPED);
        return OptionalInt.of(status);
    }

    private void transition(BridgePhase next)
    {
        BridgePhase from = phase;
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + from + " -> " + next);
        }
        phase = next;
        sink.onPhaseTransition(new BridgePhaseTransitionEvent(wallClock.now(), from, next));
    }
}

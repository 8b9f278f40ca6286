package com.questrail.bridge.runtime;

import com.questrail.bridge.api.ControlClient;
import com.questrail.bridge.config.BridgeConfig;
import com.questrail.bridge.config.ControlSection;
import com.questrail.bridge.config.ListenerSettings;
import com.questrail.bridge.config.NotifySection;
import com.questrail.bridge.control.SupervisorControlClient;
import com.questrail.bridge.control.transport.RpcTransport;
import com.questrail.bridge.control.transport.netty.NettyHttpRpcTransport;
import com.questrail.bridge.dispatch.ActionDispatcher;
import com.questrail.bridge.dispatch.CommandNotifier;
import com.questrail.bridge.dispatch.DispatchOutcome;
import com.questrail.bridge.dispatch.LoggingNotifier;
import com.questrail.bridge.dispatch.Notifier;
import com.questrail.bridge.internal.time.MonotonicClock;
import com.questrail.bridge.internal.time.SystemMonotonicClock;
import com.questrail.bridge.internal.time.SystemWallClock;
import com.questrail.bridge.internal.time.WallClock;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.bridge.protocol.listener.codec.ListenerChannel;
import com.questrail.bridge.protocol.listener.codec.impl.StreamListenerChannel;
import com.questrail.bridge.protocol.listener.internal.decode.SupervisorEventDecoder;
import com.questrail.bridge.protocol.listener.internal.exec.ListenerBridgeLoop;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;
import com.questrail.bridge.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SupervisorBridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the bridge: listener channel,
 * decoder, rule engine, control client, dispatcher and observability.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime = SupervisorBridgeRuntime.builder()...build();
 *   runtime.installShutdownHook();   // optional
 *   int status = runtime.run();      // blocks until the loop ends
 *   runtime.close();
 * </pre>
 *
 * <h2>Shutdown signal</h2>
 * {@link #handleShutdownSignal()} runs a synthetic daemon {@code STOPPING}
 * event through the rules at most once, and not at all if the loop already
 * ended on the real one or the runtime was closed.
 */
public final class SupervisorBridgeRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SupervisorBridgeRuntime.class);

    private final ListenerChannel channel;
    private final RpcTransport transport;
    private final ControlClient controlClient;
    private final ActionDispatcher dispatcher;
    private final ListenerBridgeLoop loop;
    private final RuleEngine engine;
    private final WallClock wallClock;

    private final AtomicBoolean stoppingHandled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread shutdownHook;

    private SupervisorBridgeRuntime(ListenerChannel channel,
                                    RpcTransport transport,
                                    ControlClient controlClient,
                                    ActionDispatcher dispatcher,
                                    ListenerBridgeLoop loop,
                                    RuleEngine engine,
                                    WallClock wallClock) {
        this.channel = channel;
        this.transport = transport;
        this.controlClient = controlClient;
        this.dispatcher = dispatcher;
        this.loop = loop;
        this.engine = engine;
        this.wallClock = wallClock;
    }

    /** Shared control client, for an embedding management API. */
    public ControlClient controlClient() {
        return controlClient;
    }

    public ListenerBridgeLoop loop() {
        return loop;
    }

    public RuleEngine ruleEngine() {
        return engine;
    }

    /**
     * Runs the listener loop on the calling thread.
     *
     * @return process exit status
     */
    public int run() {
        int status = loop.run();
        if (status == ListenerBridgeLoop.EXIT_NORMAL) {
            stoppingHandled.set(true);
        }
        return status;
    }

    /**
     * Registers a JVM shutdown hook that calls {@link #handleShutdownSignal()}.
     */
    public void installShutdownHook() {
        Thread hook = new Thread(this::handleShutdownSignal, "bridge-shutdown");
        shutdownHook = hook;
        Runtime.getRuntime().addShutdownHook(hook);
    }

    /**
     * Reacts to a termination signal as if the daemon announced it is stopping.
     *
     * @return outcomes of the actions dispatched; empty if already handled
     */
    public List<DispatchOutcome> handleShutdownSignal() {
        if (closed.get() || !stoppingHandled.compareAndSet(false, true)) {
            return List.of();
        }
        log.info("Termination signal received; processing synthetic daemon STOPPING");
        return loop.processSyntheticEvent(SupervisorEvent.daemonStopping(wallClock.now()));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Thread hook = shutdownHook;
        if (hook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; hook stays registered");
            }
        }
        dispatcher.close();
        transport.close();
        channel.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeConfig config;
        private InputStream input;
        private OutputStream output;
        private RpcTransport transport;
        private Notifier notifier;
        private BridgeObservabilitySink observabilitySink = new Slf4jBridgeObservabilitySink();
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withInput(InputStream input) {
            this.input = input;
            return this;
        }

        public Builder withOutput(OutputStream output) {
            this.output = output;
            return this;
        }

        /** Replaces the Netty HTTP transport built from {@code control.url}. */
        public Builder withTransport(RpcTransport transport) {
            this.transport = transport;
            return this;
        }

        /** Replaces the notifier chosen from the {@code notify} section. */
        public Builder withNotifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public SupervisorBridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Listener side
            ListenerSettings listenerSettings = config.getListener().toSettings();
            ListenerChannel channel = new StreamListenerChannel(input, output, listenerSettings.idleTimeout());
            SupervisorEventDecoder decoder = new SupervisorEventDecoder(wallClock);

            // 2. Rules
            RuleEngine engine = new RuleEngine(config.toRules(), monotonicClock);

            // 3. Control side
            ControlSection control = config.getControl();
            RpcTransport rpc = transport != null
                    ? transport
                    : new NettyHttpRpcTransport(control.toUri(), control.getUsername(), control.getPassword());
            ControlClient client = new SupervisorControlClient(
                    rpc, control.toTimingPolicy(), control.getStopAllExclusions());

            // 4. Dispatch
            NotifySection notify = config.getNotify();
            Notifier effectiveNotifier = notifier;
            if (effectiveNotifier == null) {
                effectiveNotifier = notify.hasCommand()
                        ? new CommandNotifier(notify.getCommand(), notify.timeout())
                        : new LoggingNotifier();
            }
            ActionDispatcher dispatcher = new ActionDispatcher(client, effectiveNotifier, notify.timeout());

            // 5. Loop
            ListenerBridgeLoop loop = new ListenerBridgeLoop(
                    channel,
                    decoder,
                    engine,
                    dispatcher,
                    observabilitySink,
                    wallClock,
                    listenerSettings.exitOnSupervisorStopping());

            log.info("Bridge assembled: {} rule(s), control endpoint {}, notifier {}",
                    engine.rules().size(), control.getUrl(), effectiveNotifier.getClass().getSimpleName());
            return new SupervisorBridgeRuntime(channel, rpc, client, dispatcher, loop, engine, wallClock);
        }
    }
}

package com.questrail.bridge.dispatch;

import com.questrail.bridge.api.ControlClient;
import com.questrail.bridge.api.ControlCommand;
import com.questrail.bridge.api.ControlResult;
import com.questrail.bridge.rules.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * ActionDispatcher
 * =============================================================================
 * Execution boundary between the pure rule engine and the side-effecting
 * world: the log, the notifier and the control client.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Actions run strictly in the order given, one at a time.</li>
 *   <li>Every action yields exactly one {@link DispatchOutcome}; nothing is
 *       retried.</li>
 *   <li>{@link #dispatch} never throws. A collaborator failure becomes a
 *       failed outcome and a log line.</li>
 * </ul>
 *
 * <h2>Notifications</h2>
 * Notifications run on a dedicated thread so a hung notifier cannot hold the
 * listener past {@code notifyTimeout}; on expiry the attempt is interrupted and
 * reported as failed.
 */
public final class ActionDispatcher implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ControlClient control;
    private final Notifier notifier;
    private final Duration notifyTimeout;
    private final ExecutorService notifyExecutor;

    public ActionDispatcher(ControlClient control, Notifier notifier, Duration notifyTimeout)
    {
        this.control = Objects.requireNonNull(control, "control");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.notifyTimeout = Objects.requireNonNull(notifyTimeout, "notifyTimeout");
        if (notifyTimeout.isNegative() || notifyTimeout.isZero()) {
            throw new IllegalArgumentException("notifyTimeout must be positive");
        }
        this.notifyExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bridge-notifier");
            t.setDaemon(true);
            return t;
        });
    }

    public List<DispatchOutcome> dispatchAll(List<Action> actions)
    {
        Objects.requireNonNull(actions, "actions");
        List<DispatchOutcome> outcomes = new ArrayList<>(actions.size());
        for (Action action : actions) {
            outcomes.add(dispatch(action));
        }
        return outcomes;
    }

    public DispatchOutcome dispatch(Action action)
    {
        Objects.requireNonNull(action, "action");

        DispatchOutcome outcome;
        try {
            outcome = switch (action.kind()) {
                case LOG_ONLY -> logOnly(action);
                case NOTIFY -> notify(action);
                case RESTART_DEPENDENT -> restartDependent(action);
                case INVOKE_CONTROL -> invokeControl(action);
            };
        } catch (RuntimeException e) {
            outcome = DispatchOutcome.failed(action, "unexpected error: " + e);
            log.error("Rule {} action {} failed unexpectedly", action.ruleId(), action.kind(), e);
            return outcome;
        }

        if (!outcome.success()) {
            log.warn("Rule {} action {} failed: {}", action.ruleId(), action.kind(), outcome.detail());
        }
        return outcome;
    }

    private static String describe(Throwable cause)
    {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.toString() : message;
    }

    private DispatchOutcome logOnly(Action action)
    {
        String note = action.payload().isBlank() ? "" : " - " + action.payload();
        log.info("[rule {}] {}{}", action.ruleId(), action.event().describe(), note);
        return DispatchOutcome.succeeded(action, "logged");
    }

    private DispatchOutcome notify(Action action)
    {
        Notification notification = Notification.of(action);
        Future<?> pending = notifyExecutor.submit(() -> {
            notifier.send(notification);
            return null;
        });

        try {
            pending.get(notifyTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return DispatchOutcome.succeeded(action, "notified");
        } catch (TimeoutException e) {
            pending.cancel(true);
            return DispatchOutcome.failed(action, "notification timed out after " + notifyTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return DispatchOutcome.failed(action, "notification failed: " + describe(e.getCause()));
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return DispatchOutcome.failed(action, "interrupted while notifying");
        }
    }

    private DispatchOutcome restartDependent(Action action)
    {
        String dependent = action.payload().trim();
        if (dependent.isEmpty()) {
            return DispatchOutcome.failed(action, "no dependent process named");
        }
        ControlResult r = control.restart(dependent);
        String detail = "restart " + dependent + ": " + r.outcome() + (r.message().isEmpty() ? "" : " " + r.message());
        if (r.succeeded()) {
            log.info("Rule {} restarted {} after {}", action.ruleId(), dependent, action.event().describe());
        }
        return new DispatchOutcome(action, r.succeeded(), detail);
    }

    private DispatchOutcome invokeControl(Action action)
    {
        ControlCommand command;
        try {
            command = ControlCommand.parse(action.payload());
        } catch (IllegalArgumentException e) {
            return DispatchOutcome.failed(action, e.getMessage());
        }

        List<ControlResult> results = control.execute(command);
        boolean success = results.stream().allMatch(ControlResult::succeeded);
        String detail = command.operation() + ": " + (results.isEmpty()
                ? "nothing to do"
                : results.stream()
                        .map(r -> r.name() + "=" + r.outcome())
                        .collect(Collectors.joining(", ")));
        return new DispatchOutcome(action, success, detail);
    }

    @Override
    public void close()
    {
        notifyExecutor.shutdownNow();
    }
}

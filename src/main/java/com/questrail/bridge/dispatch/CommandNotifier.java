package com.questrail.bridge.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * CommandNotifier
 * -----------------------------------------------------------------------------
 * Runs an operator-supplied hook command once per notification.
 *
 * <p>The notification is passed through the environment:</p>
 * <ul>
 *   <li>{@code BRIDGE_RULE}: id of the rule that fired</li>
 *   <li>{@code BRIDGE_PROCESS}, {@code BRIDGE_GROUP}: the process concerned</li>
 *   <li>{@code BRIDGE_EVENT}: the daemon event name</li>
 *   <li>{@code BRIDGE_MESSAGE}: the rendered message</li>
 *   <li>{@code BRIDGE_TIMESTAMP}: ISO-8601 time the event was received</li>
 * </ul>
 *
 * <p>The command's standard output is discarded because this process's own
 * standard output carries the listener protocol. Standard error is inherited.
 * A command still running at the timeout is killed.</p>
 */
public final class CommandNotifier implements Notifier
{
    private static final Logger log = LoggerFactory.getLogger(CommandNotifier.class);

    private final List<String> command;
    private final Duration timeout;

    public CommandNotifier(List<String> command, Duration timeout)
    {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public List<String> command()
    {
        return command;
    }

    @Override
    public void send(Notification n) throws NotificationException
    {
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .redirectInput(ProcessBuilder.Redirect.PIPE);
        Map<String, String> env = pb.environment();
        env.put("BRIDGE_RULE", n.ruleId());
        env.put("BRIDGE_PROCESS", n.processName());
        env.put("BRIDGE_GROUP", n.groupName());
        env.put("BRIDGE_EVENT", n.eventName());
        env.put("BRIDGE_MESSAGE", n.message());
        env.put("BRIDGE_TIMESTAMP", n.timestamp().toString());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new NotificationException("Cannot run hook " + command.get(0), e);
        }

        try {
            process.getOutputStream().close();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new NotificationException("Hook " + command.get(0) + " timed out after " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while running hook " + command.get(0), e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new NotificationException("Cannot write to hook " + command.get(0), e);
        }

        int exit = process.exitValue();
        if (exit != 0) {
            throw new NotificationException("Hook " + command.get(0) + " exited with status " + exit);
        }
        log.debug("Hook {} ran for rule {}", command.get(0), n.ruleId());
    }
}

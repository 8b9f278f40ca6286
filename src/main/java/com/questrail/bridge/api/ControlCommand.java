package com.questrail.bridge.api;

import java.util.Locale;
import java.util.Objects;

/**
 * ControlCommand
 * -----------------------------------------------------------------------------
 * A daemon operation expressed as a value, so it can be written into rule
 * configuration and executed later through {@link ControlClient#execute}.
 *
 * <p>Text form: {@code list}, {@code stopall}, {@code shutdown},
 * {@code info:<name>}, {@code start:<name>}, {@code stop:<name>},
 * {@code restart:<name>}. The verb is case-insensitive; the process name is
 * taken verbatim and may itself contain a colon ({@code restart:web:web_01}).</p>
 */
public sealed interface ControlCommand
        permits ControlCommand.ListProcesses,
                ControlCommand.Info,
                ControlCommand.Start,
                ControlCommand.Stop,
                ControlCommand.Restart,
                ControlCommand.StopAll,
                ControlCommand.Shutdown
{
    ControlOperation operation();

    record ListProcesses() implements ControlCommand {
        @Override
        public ControlOperation operation() {
            return ControlOperation.LIST;
        }
    }

    record Info(String name) implements ControlCommand {
        public Info {
            requireName(name);
        }

        @Override
        public ControlOperation operation() {
            return ControlOperation.INFO;
        }
    }

    record Start(String name) implements ControlCommand {
        public Start {
            requireName(name);
        }

        @Override
        public ControlOperation operation() {
            return ControlOperation.START;
        }
    }

    record Stop(String name) implements ControlCommand {
        public Stop {
            requireName(name);
        }

        @Override
        public ControlOperation operation() {
            return ControlOperation.STOP;
        }
    }

    record Restart(String name) implements ControlCommand {
        public Restart {
            requireName(name);
        }

        @Override
        public ControlOperation operation() {
            return ControlOperation.RESTART;
        }
    }

    record StopAll() implements ControlCommand {
        @Override
        public ControlOperation operation() {
            return ControlOperation.STOP_ALL;
        }
    }

    record Shutdown() implements ControlCommand {
        @Override
        public ControlOperation operation() {
            return ControlOperation.SHUTDOWN;
        }
    }

    /**
     * Parses the text form.
     *
     * @throws IllegalArgumentException for an unknown verb or a missing process name
     */
    static ControlCommand parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        String verb = (colon < 0 ? trimmed : trimmed.substring(0, colon))
                .toLowerCase(Locale.ROOT)
                .replace("-", "")
                .replace("_", "");
        String name = colon < 0 ? "" : trimmed.substring(colon + 1).trim();

        return switch (verb) {
            case "list" -> new ListProcesses();
            case "stopall" -> new StopAll();
            case "shutdown" -> new Shutdown();
            case "info" -> new Info(name);
            case "start" -> new Start(name);
            case "stop" -> new Stop(name);
            case "restart" -> new Restart(name);
            default -> throw new IllegalArgumentException("Unknown control command '" + text + "'");
        };
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Control command requires a process name");
        }
    }
}

package com.questrail.bridge.dispatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandNotifierTest {

    private static final Notification NOTIFICATION = new Notification(
            "worker-fatal", "worker1", "workers", "PROCESS_STATE_FATAL", "worker1 is FATAL",
            Instant.parse("2024-05-01T12:00:00Z"));

    @Test
    void passesNotificationThroughEnvironment(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("out.txt");
        CommandNotifier notifier = new CommandNotifier(List.of("/bin/sh", "-c",
                "printf '%s|%s|%s|%s|%s|%s' \"$BRIDGE_RULE\" \"$BRIDGE_PROCESS\" \"$BRIDGE_GROUP\" "
                        + "\"$BRIDGE_EVENT\" \"$BRIDGE_MESSAGE\" \"$BRIDGE_TIMESTAMP\" > " + out),
                Duration.ofSeconds(10));

        notifier.send(NOTIFICATION);

        assertEquals("worker-fatal|worker1|workers|PROCESS_STATE_FATAL|worker1 is FATAL|2024-05-01T12:00:00Z",
                Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void nonZeroExitFails() {
        CommandNotifier notifier = new CommandNotifier(List.of("/bin/sh", "-c", "exit 3"), Duration.ofSeconds(10));

        NotificationException e = assertThrows(NotificationException.class, () -> notifier.send(NOTIFICATION));
        assertTrue(e.getMessage().contains("status 3"));
    }

    @Test
    void hookStillRunningAtTimeoutIsKilled() {
        CommandNotifier notifier = new CommandNotifier(List.of("/bin/sh", "-c", "sleep 30"), Duration.ofMillis(200));

        NotificationException e = assertThrows(NotificationException.class, () -> notifier.send(NOTIFICATION));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void missingExecutableFails(@TempDir Path dir) {
        CommandNotifier notifier = new CommandNotifier(List.of(dir.resolve("nope").toString()), Duration.ofSeconds(1));

        assertThrows(NotificationException.class, () -> notifier.send(NOTIFICATION));
    }

    @Test
    void rejectsEmptyCommand() {
        assertThrows(IllegalArgumentException.class, () -> new CommandNotifier(List.of(), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new CommandNotifier(List.of("/bin/true"), Duration.ZERO));
    }
}

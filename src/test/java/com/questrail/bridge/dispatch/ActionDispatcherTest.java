package com.questrail.bridge.dispatch;

import com.questrail.bridge.api.ControlOperation;
import com.questrail.bridge.api.ControlOutcome;
import com.questrail.bridge.api.FakeControlClient;
import com.questrail.bridge.api.ProcessStatus;
import com.questrail.bridge.protocol.listener.model.ProcessState;
import com.questrail.bridge.protocol.listener.model.TestEvents;
import com.questrail.bridge.rules.Action;
import com.questrail.bridge.rules.ActionKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActionDispatcherTest
 * -----------------------------------------------------------------------------
 * Every action yields one outcome and no collaborator failure escapes.
 */
class ActionDispatcherTest {

    private final FakeControlClient control = new FakeControlClient();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private ActionDispatcher dispatcher = new ActionDispatcher(control, notifier, Duration.ofSeconds(2));

    @AfterEach
    void close() {
        dispatcher.close();
    }

    private static Action action(ActionKind kind, String payload) {
        return new Action(kind, "r1", "db",
                payload, TestEvents.process("db", "db", ProcessState.RUNNING, ProcessState.FATAL));
    }

    @Test
    void logOnlyAlwaysSucceeds() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.LOG_ONLY, ""));

        assertTrue(outcome.success());
        assertEquals("logged", outcome.detail());
        assertTrue(control.commands().isEmpty());
    }

    @Test
    void notifyHandsRenderedMessageToNotifier() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.NOTIFY, "db is FATAL"));

        assertTrue(outcome.success());
        List<Notification> sent = notifier.sent();
        assertEquals(1, sent.size());
        Notification n = sent.get(0);
        assertEquals("r1", n.ruleId());
        assertEquals("db", n.processName());
        assertEquals("PROCESS_STATE_FATAL", n.eventName());
        assertEquals("db is FATAL", n.message());
        assertEquals(TestEvents.T0, n.timestamp());
    }

    @Test
    void failingNotifierYieldsFailedOutcome() {
        notifier.failingWith(new NotificationException("smtp down"));

        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.NOTIFY, "x"));

        assertFalse(outcome.success());
        assertEquals("notification failed: smtp down", outcome.detail());
    }

    @Test
    void notifierFailureWithoutMessageNamesTheExceptionType() {
        dispatcher.close();
        dispatcher = new ActionDispatcher(control, n -> {
            throw new IllegalStateException();
        }, Duration.ofSeconds(2));

        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.NOTIFY, "x"));

        assertFalse(outcome.success());
        assertEquals("notification failed: java.lang.IllegalStateException", outcome.detail());
    }

    @Test
    void hungNotifierIsAbandonedAtTimeout() {
        dispatcher.close();
        dispatcher = new ActionDispatcher(control, notifier, Duration.ofMillis(100));
        CountDownLatch release = notifier.hanging();

        long start = System.nanoTime();
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.NOTIFY, "x"));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertFalse(outcome.success());
        assertEquals("notification timed out after 100 ms", outcome.detail());
        assertTrue(elapsedMillis < 2_000, "dispatch took " + elapsedMillis + " ms");
        release.countDown();
    }

    @Test
    void restartDependentRestartsPayloadProcess() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.RESTART_DEPENDENT, "web:api"));

        assertTrue(outcome.success());
        assertEquals(List.of("RESTART:web:api"), control.commands());
        assertTrue(outcome.detail().startsWith("restart web:api: OK"));
    }

    @Test
    void restartDependentReportsControlFailure() {
        control.answer(ControlOperation.RESTART, "web:api", ControlOutcome.UNREACHABLE);

        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.RESTART_DEPENDENT, "web:api"));

        assertFalse(outcome.success());
        assertTrue(outcome.detail().contains("UNREACHABLE"));
    }

    @Test
    void restartDependentWithoutPayloadFails() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.RESTART_DEPENDENT, " "));

        assertFalse(outcome.success());
        assertTrue(control.commands().isEmpty());
    }

    @Test
    void invokeControlRunsParsedCommand() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.INVOKE_CONTROL, "stop:workers:worker2"));

        assertTrue(outcome.success());
        assertEquals(List.of("STOP:workers:worker2"), control.commands());
        assertEquals("STOP: workers:worker2=OK", outcome.detail());
    }

    @Test
    void invokeControlStopAllFailsIfAnyStopFails() {
        control.withProcesses(List.of(
                        new ProcessStatus("a", "a", ProcessState.RUNNING, OptionalInt.of(1)),
                        new ProcessStatus("b", "b", ProcessState.RUNNING, OptionalInt.of(2))))
                .answer(ControlOperation.STOP, "b", ControlOutcome.REJECTED);

        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.INVOKE_CONTROL, "stopall"));

        assertFalse(outcome.success());
        assertEquals("STOP_ALL: a=OK, b=REJECTED", outcome.detail());
    }

    @Test
    void invokeControlWithNothingToStopSucceeds() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.INVOKE_CONTROL, "stopall"));

        assertTrue(outcome.success());
        assertEquals("STOP_ALL: nothing to do", outcome.detail());
    }

    @Test
    void invokeControlWithBadCommandFailsWithoutCalling() {
        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.INVOKE_CONTROL, "reboot:now"));

        assertFalse(outcome.success());
        assertTrue(control.commands().isEmpty());
    }

    @Test
    void unexpectedCollaboratorExceptionBecomesFailedOutcome() {
        control.failWith(new IllegalStateException("boom"));

        DispatchOutcome outcome = dispatcher.dispatch(action(ActionKind.RESTART_DEPENDENT, "api"));

        assertFalse(outcome.success());
        assertTrue(outcome.detail().startsWith("unexpected error: "));
    }

    @Test
    void dispatchAllKeepsOrderAndContinuesAfterFailure() {
        control.answer(ControlOperation.RESTART, "api", ControlOutcome.NOT_FOUND);

        List<DispatchOutcome> outcomes = dispatcher.dispatchAll(List.of(
                action(ActionKind.RESTART_DEPENDENT, "api"),
                action(ActionKind.NOTIFY, "after"),
                action(ActionKind.LOG_ONLY, "")));

        assertEquals(3, outcomes.size());
        assertEquals(List.of(false, true, true), outcomes.stream().map(DispatchOutcome::success).toList());
        assertEquals(1, notifier.sent().size());
    }
}

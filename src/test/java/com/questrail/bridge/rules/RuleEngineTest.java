package com.questrail.bridge.rules;

import com.questrail.bridge.protocol.listener.model.EventKind;
import com.questrail.bridge.protocol.listener.model.ProcessState;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;
import com.questrail.bridge.protocol.listener.model.TestEvents;
import com.questrail.bridge.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RuleEngineTest
 * -----------------------------------------------------------------------------
 * Matching, ordering and cooldown suppression, driven by a manual clock.
 */
class RuleEngineTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();

    private static Rule notifyOnFatal(Duration cooldown) {
        return new Rule("fatal", RuleMatch.toState(ProcessState.FATAL).forProcesses(Set.of("worker1")),
                ActionKind.NOTIFY, "", cooldown);
    }

    @Test
    void fatalWithinCooldownIsSuppressedAndFiresAgainAfterIt() {
        clock.advanceSeconds(1000);
        RuleEngine engine = new RuleEngine(List.of(notifyOnFatal(Duration.ofSeconds(60))), clock);
        SupervisorEvent fatal = TestEvents.process("worker1", "workers", ProcessState.BACKOFF, ProcessState.FATAL);

        List<Action> first = engine.evaluate(fatal);
        assertEquals(1, first.size());
        assertEquals(ActionKind.NOTIFY, first.get(0).kind());
        assertEquals("worker1", first.get(0).targetProcess());

        clock.advanceSeconds(10);
        assertTrue(engine.evaluate(fatal).isEmpty());

        clock.advanceSeconds(51);
        assertEquals(1, engine.evaluate(fatal).size());
    }

    @Test
    void exactlyAtCooldownBoundaryFires() {
        RuleEngine engine = new RuleEngine(List.of(notifyOnFatal(Duration.ofSeconds(60))), clock);
        SupervisorEvent fatal = TestEvents.process("worker1", ProcessState.FATAL);

        assertEquals(1, engine.evaluate(fatal).size());
        clock.advanceSeconds(60);
        assertEquals(1, engine.evaluate(fatal).size());
    }

    @Test
    void zeroCooldownNeverSuppresses() {
        RuleEngine engine = new RuleEngine(List.of(notifyOnFatal(Duration.ZERO)), clock);
        SupervisorEvent fatal = TestEvents.process("worker1", ProcessState.FATAL);

        for (int i = 0; i < 5; i++) {
            assertEquals(1, engine.evaluate(fatal).size());
        }
    }

    @Test
    void cooldownIsTrackedPerProcess() {
        Rule anyFatal = new Rule("fatal", RuleMatch.toState(ProcessState.FATAL), ActionKind.LOG_ONLY, "",
                Duration.ofSeconds(60));
        RuleEngine engine = new RuleEngine(List.of(anyFatal), clock);

        assertEquals(1, engine.evaluate(TestEvents.process("a", ProcessState.FATAL)).size());
        assertEquals(1, engine.evaluate(TestEvents.process("b", ProcessState.FATAL)).size());
        assertTrue(engine.evaluate(TestEvents.process("a", ProcessState.FATAL)).isEmpty());
        assertEquals(2, engine.cooldowns().size());
    }

    @Test
    void everyMatchingRuleFiresInDeclarationOrder() {
        Rule log = new Rule("log", RuleMatch.toState(ProcessState.FATAL), ActionKind.LOG_ONLY, "", Duration.ZERO);
        Rule restart = new Rule("restart", RuleMatch.toState(ProcessState.FATAL), ActionKind.RESTART_DEPENDENT,
                "api", Duration.ZERO);
        Rule notify = new Rule("notify", RuleMatch.toState(ProcessState.FATAL), ActionKind.NOTIFY, "", Duration.ZERO);
        RuleEngine engine = new RuleEngine(List.of(log, restart, notify), clock);

        List<Action> actions = engine.evaluate(TestEvents.process("db", ProcessState.FATAL));

        assertEquals(List.of("log", "restart", "notify"), actions.stream().map(Action::ruleId).toList());
        assertEquals("api", actions.get(1).payload());
    }

    @Test
    void suppressionOfOneRuleDoesNotAffectAnother() {
        Rule slow = new Rule("slow", RuleMatch.toState(ProcessState.FATAL), ActionKind.LOG_ONLY, "",
                Duration.ofMinutes(10));
        Rule fast = new Rule("fast", RuleMatch.toState(ProcessState.FATAL), ActionKind.LOG_ONLY, "",
                Duration.ofSeconds(5));
        RuleEngine engine = new RuleEngine(List.of(slow, fast), clock);
        SupervisorEvent fatal = TestEvents.process("db", ProcessState.FATAL);

        assertEquals(2, engine.evaluate(fatal).size());
        clock.advanceSeconds(6);

        List<Action> second = engine.evaluate(fatal);
        assertEquals(1, second.size());
        assertEquals("fast", second.get(0).ruleId());
    }

    @Test
    void nonMatchingEventsProduceNothingAndRecordNothing() {
        RuleEngine engine = new RuleEngine(List.of(notifyOnFatal(Duration.ofSeconds(60))), clock);

        assertTrue(engine.evaluate(TestEvents.process("worker1", ProcessState.RUNNING)).isEmpty());
        assertTrue(engine.evaluate(TestEvents.process("worker2", ProcessState.FATAL)).isEmpty());
        assertEquals(0, engine.cooldowns().size());
    }

    @Test
    void matchFiltersOnEventKindAndExitExpectation() {
        Rule unexpected = new Rule("unexpected",
                new RuleMatch(Set.of(ProcessState.EXITED), Set.of(), Set.of(EventKind.PROCESS_STATE_CHANGED),
                        Optional.of(false)),
                ActionKind.LOG_ONLY, "", Duration.ZERO);
        Rule daemon = new Rule("daemon",
                new RuleMatch(Set.of(), Set.of(), Set.of(EventKind.SUPERVISOR_STATE_CHANGED), Optional.empty()),
                ActionKind.LOG_ONLY, "", Duration.ZERO);
        RuleEngine engine = new RuleEngine(List.of(unexpected, daemon), clock);

        assertEquals(List.of("unexpected"), ids(engine.evaluate(TestEvents.exited("a", false))));
        assertTrue(engine.evaluate(TestEvents.exited("a", true)).isEmpty());
        assertTrue(engine.evaluate(TestEvents.process("a", ProcessState.EXITED)).isEmpty());
        assertEquals(List.of("daemon"), ids(engine.evaluate(TestEvents.daemonRunning())));
    }

    @Test
    void notifyPayloadIsRenderedFromTemplate() {
        Rule rule = new Rule("n", RuleMatch.toState(ProcessState.FATAL), ActionKind.NOTIFY,
                "{group}/{process} pid={pid} {from}->{to} via {event}", Duration.ZERO);
        RuleEngine engine = new RuleEngine(List.of(rule), clock);

        Action a = engine.evaluate(
                TestEvents.process("worker1", "workers", ProcessState.BACKOFF, ProcessState.FATAL)).get(0);

        assertEquals("workers/worker1 pid=4242 BACKOFF->FATAL via PROCESS_STATE_FATAL", a.payload());
    }

    @Test
    void blankNotifyTemplateUsesDefaultMessage() {
        RuleEngine engine = new RuleEngine(List.of(notifyOnFatal(Duration.ZERO)), clock);

        Action a = engine.evaluate(TestEvents.process("worker1", ProcessState.FATAL)).get(0);

        assertEquals("worker1 (worker1) ? -> FATAL [PROCESS_STATE_FATAL]", a.payload());
    }

    @Test
    void duplicateRuleIdsAreRejected() {
        Rule a = notifyOnFatal(Duration.ZERO);
        assertThrows(IllegalArgumentException.class, () -> new RuleEngine(List.of(a, a), clock));
    }

    @Test
    void ruleValidatesItsFields() {
        assertThrows(IllegalArgumentException.class, () -> new Rule(" ", RuleMatch.toState(ProcessState.FATAL),
                ActionKind.LOG_ONLY, "", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new Rule("r", RuleMatch.toState(ProcessState.FATAL),
                ActionKind.LOG_ONLY, "", Duration.ofSeconds(-1)));
    }

    private static List<String> ids(List<Action> actions) {
        return actions.stream().map(Action::ruleId).toList();
    }
}

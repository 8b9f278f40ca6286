package com.questrail.bridge.observability;

import com.questrail.bridge.dispatch.DispatchOutcome;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Each decoded event is logged at INFO in the operator format
 * {@code [group: process (pid)] EVENT: FROM -> TO}.</p>
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onPhaseTransition(BridgePhaseTransitionEvent event) {
        if (event.isTermination()) {
            log.info("Listener loop stopped (was {})", event.from());
        } else {
            log.trace("Phase {} -> {}", event.from(), event.to());
        }
    }

    @Override
    public void onEventReceived(SupervisorEvent event) {
        log.info("{}", event.describe());
    }

    @Override
    public void onDispatchOutcome(DispatchOutcome outcome) {
        log.debug("Rule {} {} -> {} ({})",
            outcome.action().ruleId(),
            outcome.action().kind(),
            outcome.success() ? "ok" : "failed",
            outcome.detail());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        if (event.cause() == null) {
            log.error("Bridge error: {}", event.message());
        } else {
            log.error("Bridge error: {}", event.message(), event.cause());
        }
    }
}

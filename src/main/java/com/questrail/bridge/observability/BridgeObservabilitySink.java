package com.questrail.bridge.observability;

import com.questrail.bridge.dispatch.DispatchOutcome;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;

/**
 * Main interface for receiving bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the listener loop changes phase.
     * @param event the transition details
     */
    void onPhaseTransition(BridgePhaseTransitionEvent event);

    /**
     * Called once per successfully decoded event, before rules are evaluated.
     * @param event the decoded event
     */
    void onEventReceived(SupervisorEvent event);

    /**
     * Called after each action has been executed.
     * @param outcome the dispatch result
     */
    void onDispatchOutcome(DispatchOutcome outcome);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}

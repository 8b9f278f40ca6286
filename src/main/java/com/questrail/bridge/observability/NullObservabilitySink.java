package com.questrail.bridge.observability;

import com.questrail.bridge.dispatch.DispatchOutcome;
import com.questrail.bridge.protocol.listener.model.SupervisorEvent;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(BridgePhaseTransitionEvent event) {}

    @Override
    public void onEventReceived(SupervisorEvent event) {}

    @Override
    public void onDispatchOutcome(DispatchOutcome outcome) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}

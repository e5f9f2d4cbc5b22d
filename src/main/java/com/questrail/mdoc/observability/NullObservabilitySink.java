package com.questrail.mdoc.observability;

/**
 * No-op implementation of MdocObservabilitySink.
 */
public final class NullObservabilitySink implements MdocObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportStateTransition(TransportStateTransitionEvent event) {}

    @Override
    public void onSessionEvent(SessionObservabilityEvent event) {}

    @Override
    public void onError(MdocErrorEvent event) {}
}

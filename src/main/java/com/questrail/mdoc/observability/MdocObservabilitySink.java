package com.questrail.mdoc.observability;

/**
 * Main interface for receiving presentment observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface MdocObservabilitySink {
    /**
     * Called when a transport moves between lifecycle states.
     * @param event the transition event details
     */
    void onTransportStateTransition(TransportStateTransitionEvent event);

    /**
     * Called when a session-level event occurs (establishment, request, response, termination).
     * @param event the session event
     */
    void onSessionEvent(SessionObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the stack.
     * @param event the error event
     */
    void onError(MdocErrorEvent event);
}

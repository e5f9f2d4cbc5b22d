package com.questrail.mdoc.observability;

import com.questrail.mdoc.transport.TransportState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements MdocObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransportStateTransition(TransportStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSessionEvent(SessionObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(MdocErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<TransportStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof TransportStateTransitionEvent)
            .map(e -> (TransportStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<TransportState> statesOf(String transport) {
        return getStateTransitions().stream()
            .filter(e -> e.transport().equals(transport))
            .map(TransportStateTransitionEvent::newState)
            .collect(Collectors.toList());
    }

    public synchronized List<SessionObservabilityEvent.Kind> getSessionEventKinds() {
        return events.stream()
            .filter(e -> e instanceof SessionObservabilityEvent)
            .map(e -> ((SessionObservabilityEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

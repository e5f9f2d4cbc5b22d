package com.questrail.mdoc.observability;

import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.transport.TransportState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of one transport.
 */
public record TransportStateTransitionEvent(
    Instant timestamp,
    String transport,
    Role role,
    TransportState oldState,
    TransportState newState
) {
    public boolean isTerminal() {
        return newState == TransportState.CLOSED || newState == TransportState.FAILED;
    }
}

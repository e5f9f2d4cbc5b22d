package com.questrail.mdoc.observability;

import com.questrail.mdoc.model.Role;

import java.time.Instant;

/**
 * Record representing a session milestone.
 */
public record SessionObservabilityEvent(
    Instant timestamp,
    Role role,
    Kind kind,
    String detail
) {
    public enum Kind {
        ENGAGEMENT_CREATED,
        SESSION_ESTABLISHED,
        REQUEST_SENT,
        REQUEST_RECEIVED,
        RESPONSE_SENT,
        RESPONSE_RECEIVED,
        TERMINATED
    }
}

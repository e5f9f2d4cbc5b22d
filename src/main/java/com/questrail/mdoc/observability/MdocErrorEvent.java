package com.questrail.mdoc.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the presentment stack.
 */
public record MdocErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

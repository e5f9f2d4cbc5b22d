package com.questrail.mdoc.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal handle for undoing a registration, such as a cancellation callback.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the registration was removed; {@code false} if it
     *         had already fired or was previously cancelled.
     */
    boolean cancel();
}

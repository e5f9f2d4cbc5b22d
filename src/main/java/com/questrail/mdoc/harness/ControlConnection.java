package com.questrail.mdoc.harness;

import java.time.Duration;

/**
 * ControlConnection
 * -----------------------------------------------------------------------------
 * Port for one established harness control connection.
 */
public interface ControlConnection extends AutoCloseable
{
    /**
     * @throws HarnessException if the message could not be written
     */
    void send(ControlMessage message);

    /**
     * Waits for the next message from the peer.
     *
     * @throws HarnessException on timeout or when the connection is closed
     */
    ControlMessage receive(Duration timeout);

    /** Idempotent. */
    @Override
    void close();
}

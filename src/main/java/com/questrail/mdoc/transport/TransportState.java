package com.questrail.mdoc.transport;

/**
 * Lifecycle of an {@link MdocTransport}.
 *
 * <pre>
 * INITIALIZING -> CONNECTING -> CONNECTED -> CLOSING -> CLOSED
 *                     \              \
 *                      +-> FAILED     +-> FAILED
 * </pre>
 */
public enum TransportState
{
    INITIALIZING,
    CONNECTING,
    CONNECTED,
    CLOSING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}

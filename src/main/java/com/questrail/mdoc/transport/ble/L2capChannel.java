package com.questrail.mdoc.transport.ble;

/**
 * A connected L2CAP connection-oriented channel. Stream semantics: writes may
 * arrive at the peer split or coalesced.
 */
public interface L2capChannel
{
    void setListener(L2capChannelListener listener);

    void write(byte[] bytes);

    /** Idempotent. */
    void close();
}

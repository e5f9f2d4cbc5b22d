package com.questrail.mdoc.transport.ble;

/**
 * Callback sink for {@link L2capChannel}.
 */
public interface L2capChannelListener
{
    void onData(byte[] bytes);

    /** The peer closed the channel, or it broke. */
    void onClosed();
}

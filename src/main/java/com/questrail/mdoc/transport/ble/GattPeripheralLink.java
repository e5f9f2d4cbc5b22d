package com.questrail.mdoc.transport.ble;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * GattPeripheralLink
 * -----------------------------------------------------------------------------
 * Port for the GATT server side of a BLE radio.
 */
public interface GattPeripheralLink
{
    /**
     * Register the listener for writes and disconnects. Must be called before
     * {@link #publish}.
     */
    void setListener(GattLinkListener listener);

    /**
     * Starts an L2CAP server socket.
     *
     * @param onAccepted invoked once per accepted channel
     * @return the PSM peers connect to
     */
    int listenL2cap(Consumer<L2capChannel> onAccepted);

    /**
     * Adds the GATT service and starts advertising {@code serviceUuid}.
     *
     * @param characteristics every characteristic of the service
     * @param readOnlyValues  fixed values of readable characteristics (ident, L2CAP PSM)
     */
    void publish(UUID serviceUuid, Set<UUID> characteristics, Map<UUID, byte[]> readOnlyValues);

    /** The MTU negotiated by the connected central. */
    int mtu();

    void notifyCharacteristic(UUID characteristic, byte[] value);

    /** Stops advertising and drops any connection. Idempotent. */
    void close();
}

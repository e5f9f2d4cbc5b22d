package com.questrail.mdoc.transport.ble;

import java.util.UUID;

/**
 * GattLinkListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link GattCentralLink} and {@link GattPeripheralLink}.
 *
 * <p>Callbacks must be delivered serialized per link. Values are delivered exactly
 * as received; the listener owns the array.</p>
 */
public interface GattLinkListener
{
    /**
     * On a central: a notification from the server. On a peripheral: a write
     * from the central.
     */
    void onCharacteristicValue(UUID characteristic, byte[] value);

    /**
     * The GATT connection went away.
     */
    void onDisconnected();
}

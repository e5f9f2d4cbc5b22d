package com.questrail.mdoc.harness;

import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.transport.ble.BleMode;

import java.util.UUID;

/**
 * The BLE flavours a test plan entry can exercise.
 */
public enum HarnessTransport
{
    BLE_CENTRAL_CLIENT(BleMode.CENTRAL_CLIENT, false),
    BLE_CENTRAL_CLIENT_L2CAP(BleMode.CENTRAL_CLIENT, true),
    BLE_PERIPHERAL_SERVER(BleMode.PERIPHERAL_SERVER, false),
    BLE_PERIPHERAL_SERVER_L2CAP(BleMode.PERIPHERAL_SERVER, true);

    private final BleMode mode;
    private final boolean useL2cap;

    HarnessTransport(BleMode mode, boolean useL2cap) {
        this.mode = mode;
        this.useL2cap = useL2cap;
    }

    public BleMode mode() {
        return mode;
    }

    public boolean useL2cap() {
        return useL2cap;
    }

    /** A connection method for one iteration, with a fresh service UUID. */
    public BleConnectionMethod newConnectionMethod() {
        UUID uuid = UUID.randomUUID();
        return mode == BleMode.CENTRAL_CLIENT
                ? BleConnectionMethod.centralClient(uuid)
                : BleConnectionMethod.peripheralServer(uuid);
    }
}

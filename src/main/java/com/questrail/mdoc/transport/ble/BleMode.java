package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.model.Role;

/**
 * The two GATT arrangements of ISO 18013-5 BLE data retrieval, named from the
 * holder's point of view.
 */
public enum BleMode
{
    /** Holder is the GATT central (client); reader is the GATT server. */
    CENTRAL_CLIENT,
    /** Holder is the GATT server; reader is the GATT central (client). */
    PERIPHERAL_SERVER;

    /** The mode in which {@code role} acts as GATT central. */
    public static BleMode forCentral(Role role) {
        return role == Role.HOLDER ? CENTRAL_CLIENT : PERIPHERAL_SERVER;
    }

    /** The mode in which {@code role} acts as GATT server. */
    public static BleMode forPeripheral(Role role) {
        return role == Role.HOLDER ? PERIPHERAL_SERVER : CENTRAL_CLIENT;
    }
}

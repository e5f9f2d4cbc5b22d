package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.transport.ConnectionTimeoutException;

import java.time.Duration;
import java.util.UUID;

/**
 * GattCentralLink
 * -----------------------------------------------------------------------------
 * Port for the GATT client side of a BLE radio.
 *
 * <p>The port does radio I/O only: no chunking, no state characteristic
 * semantics, no ident check. Radio errors surface as unchecked exceptions
 * (typically {@link java.io.UncheckedIOException}).</p>
 */
public interface GattCentralLink
{
    /**
     * Register the listener for notifications and disconnects. Must be called
     * before {@link #connect(UUID, Duration)}.
     */
    void setListener(GattLinkListener listener);

    /**
     * Scans for a peripheral advertising {@code serviceUuid}, connects, and
     * discovers its service. Blocks until done.
     *
     * @throws ConnectionTimeoutException if no peripheral is found in time
     */
    void connect(UUID serviceUuid, Duration timeout);

    /**
     * @return the negotiated MTU
     */
    int requestMtu(int mtu);

    boolean hasCharacteristic(UUID characteristic);

    byte[] readCharacteristic(UUID characteristic);

    void writeCharacteristic(UUID characteristic, byte[] value);

    void enableNotifications(UUID characteristic);

    L2capChannel connectL2cap(int psm);

    /** Idempotent. */
    void disconnect();
}

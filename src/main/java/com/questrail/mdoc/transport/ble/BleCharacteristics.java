package com.questrail.mdoc.transport.ble;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Characteristic UUIDs of the mdoc GATT service for one {@link BleMode}.
 *
 * <p>Only central-client mode has an ident characteristic: the reader, acting
 * as GATT server, exposes it and the holder checks it.</p>
 */
public record BleCharacteristics(
    UUID state,
    UUID clientToServer,
    UUID serverToClient,
    UUID ident,
    UUID l2cap
) {
    private static final String SUFFIX = "-a123-48ce-896b-4c76973373e6";

    public static final BleCharacteristics CENTRAL_CLIENT_MODE = new BleCharacteristics(
            uuid("00000005"), uuid("00000006"), uuid("00000007"), uuid("00000008"), uuid("0000000b"));

    public static final BleCharacteristics PERIPHERAL_SERVER_MODE = new BleCharacteristics(
            uuid("00000001"), uuid("00000002"), uuid("00000003"), null, uuid("0000000a"));

    public static final byte STATE_START = 0x01;
    public static final byte STATE_END = 0x02;

    public static BleCharacteristics forMode(BleMode mode) {
        return mode == BleMode.CENTRAL_CLIENT ? CENTRAL_CLIENT_MODE : PERIPHERAL_SERVER_MODE;
    }

    public Optional<UUID> identOptional() {
        return Optional.ofNullable(ident);
    }

    /** Every characteristic of the service, including L2CAP. */
    public Set<UUID> all() {
        Set<UUID> all = new LinkedHashSet<>();
        all.add(state);
        all.add(clientToServer);
        all.add(serverToClient);
        if (ident != null) {
            all.add(ident);
        }
        all.add(l2cap);
        return all;
    }

    private static UUID uuid(String prefix) {
        return UUID.fromString(prefix + SUFFIX);
    }
}

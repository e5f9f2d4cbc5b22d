package com.questrail.mdoc.engagement;

import com.questrail.mdoc.connectionmethod.ConnectionMethod;

import java.security.interfaces.ECPublicKey;
import java.util.List;
import java.util.Objects;

/**
 * Device engagement as produced by the holder (QR code or NFC).
 *
 * @param version           engagement version, {@code "1.0"} unless newer features are used
 * @param eDeviceKey        the holder's ephemeral session key
 * @param connectionMethods ways to reach the holder; never empty
 */
public record DeviceEngagement(
    String version,
    ECPublicKey eDeviceKey,
    List<ConnectionMethod> connectionMethods
) {
    public static final String VERSION_1_0 = "1.0";

    public DeviceEngagement {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(eDeviceKey, "eDeviceKey");
        connectionMethods = List.copyOf(connectionMethods);
        if (connectionMethods.isEmpty()) {
            throw new IllegalArgumentException("Device engagement needs at least one connection method");
        }
    }

    public static DeviceEngagement of(ECPublicKey eDeviceKey, List<ConnectionMethod> connectionMethods) {
        return new DeviceEngagement(VERSION_1_0, eDeviceKey, connectionMethods);
    }
}

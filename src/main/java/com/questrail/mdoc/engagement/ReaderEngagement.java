package com.questrail.mdoc.engagement;

import com.questrail.mdoc.connectionmethod.ConnectionMethod;

import java.security.interfaces.ECPublicKey;
import java.util.List;
import java.util.Objects;

/**
 * Reader engagement, used when the reader initiates (reader-first NFC flows).
 * Same layout as {@link DeviceEngagement} with the reader's ephemeral key.
 */
public record ReaderEngagement(
    String version,
    ECPublicKey eReaderKey,
    List<ConnectionMethod> connectionMethods
) {
    public static final String VERSION_1_1 = "1.1";

    public ReaderEngagement {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(eReaderKey, "eReaderKey");
        connectionMethods = List.copyOf(connectionMethods);
        if (connectionMethods.isEmpty()) {
            throw new IllegalArgumentException("Reader engagement needs at least one connection method");
        }
    }

    public static ReaderEngagement of(ECPublicKey eReaderKey, List<ConnectionMethod> connectionMethods) {
        return new ReaderEngagement(VERSION_1_1, eReaderKey, connectionMethods);
    }
}
